package com.codeheadsystems.shardvault.dao;

import com.codeheadsystems.shardvault.model.Slot;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * The interface Slot dao.
 */
public interface SlotDao {

  /**
   * Gets content.
   *
   * @param name the name
   * @return the content
   */
  @SqlQuery("select CONTENT from VAULT_SLOT where NAME = :name")
  Optional<String> getContent(@Bind("name") String name);

  /**
   * Gets slots. The collection must not be empty.
   *
   * @param names the names
   * @return the slots that exist
   */
  @SqlQuery("select NAME, CONTENT from VAULT_SLOT where NAME in (<names>)")
  List<Slot> getSlots(@BindList("names") Collection<String> names);

  /**
   * Insert all, pairing names and contents by index.
   *
   * @param names    the names
   * @param contents the contents
   * @return rows changed per insert
   */
  @SqlBatch("insert into VAULT_SLOT (NAME, CONTENT) values (:name, :content)")
  int[] insertAll(@Bind("name") List<String> names, @Bind("content") List<String> contents);

  /**
   * Delete boolean.
   *
   * @param name the name
   * @return the boolean
   */
  @SqlUpdate("delete from VAULT_SLOT where NAME = :name")
  boolean delete(@Bind("name") String name);

  /**
   * Delete all. The collection must not be empty.
   *
   * @param names the names
   * @return rows deleted
   */
  @SqlUpdate("delete from VAULT_SLOT where NAME in (<names>)")
  int deleteAll(@BindList("names") Collection<String> names);

}

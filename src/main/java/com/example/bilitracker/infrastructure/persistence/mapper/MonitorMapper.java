package com.example.bilitracker.infrastructure.persistence.mapper;

import com.example.bilitracker.infrastructure.persistence.entity.MonitorEntity;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface MonitorMapper {

    String COLUMNS = "id, mid, remote_id, type, name, cover, description, total_count, last_check_ts, "
            + "is_active, archived, created_at";

    @Insert("INSERT INTO monitor(mid, remote_id, type, name, cover, description, total_count, last_check_ts, "
            + "is_active, archived) "
            + "VALUES(#{mid}, #{remoteId}, #{type}, #{name}, #{cover}, #{description}, #{totalCount}, "
            + "#{lastCheckTs}, #{isActive}, #{archived})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(MonitorEntity entity);

    @Select("SELECT " + COLUMNS + " FROM monitor WHERE id = #{id}")
    MonitorEntity selectById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM monitor ORDER BY id DESC")
    List<MonitorEntity> selectAll();

    @Select("SELECT " + COLUMNS + " FROM monitor WHERE is_active = 1 AND archived = 0 ORDER BY id DESC")
    List<MonitorEntity> selectActive();

    @Select("SELECT " + COLUMNS + " FROM monitor WHERE archived = 1 ORDER BY id DESC")
    List<MonitorEntity> selectArchived();

    @Select("SELECT COUNT(1) FROM monitor WHERE remote_id = #{remoteId} AND type = #{type}")
    int countByRemoteIdAndType(@Param("remoteId") String remoteId, @Param("type") String type);

    @Select("SELECT COUNT(1) FROM monitor")
    int countAll();

    @Select("SELECT COUNT(1) FROM monitor WHERE is_active = 1 AND archived = 0")
    int countActive();

    @Update("UPDATE monitor SET total_count = #{totalCount}, last_check_ts = #{lastCheckTs} WHERE id = #{id}")
    int updateStatus(@Param("id") Long id,
                     @Param("totalCount") int totalCount,
                     @Param("lastCheckTs") long lastCheckTs);

    @Update("UPDATE monitor SET last_check_ts = #{lastCheckTs} WHERE id = #{id}")
    int touchLastCheck(@Param("id") Long id, @Param("lastCheckTs") long lastCheckTs);

    @Update("UPDATE monitor SET is_active = #{isActive} WHERE id = #{id}")
    int updateActive(@Param("id") Long id, @Param("isActive") int isActive);

    /** Archiving also pauses the monitor. */
    @Update("UPDATE monitor SET archived = 1, is_active = 0 WHERE id = #{id}")
    int archive(@Param("id") Long id);

    @Update("UPDATE monitor SET archived = 0 WHERE id = #{id}")
    int unarchive(@Param("id") Long id);

    @Delete("DELETE FROM monitor WHERE id = #{id}")
    int deleteById(@Param("id") Long id);
}

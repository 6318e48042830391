package com.example.bilitracker.infrastructure.persistence.mapper;

import com.example.bilitracker.infrastructure.persistence.entity.VideoUpdateEntity;
import com.example.bilitracker.infrastructure.persistence.model.PublishTimeRow;
import com.example.bilitracker.infrastructure.persistence.model.RecentUpdateRow;
import java.util.Collection;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface VideoUpdateMapper {

    @Insert("INSERT INTO video_update(monitor_id, video_id, video_title, publish_time, cover) "
            + "VALUES(#{monitorId}, #{videoId}, #{videoTitle}, #{publishTime}, #{cover})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(VideoUpdateEntity entity);

    @Select("SELECT COUNT(1) FROM video_update WHERE video_id = #{videoId}")
    int countByVideoId(@Param("videoId") String videoId);

    @Select("SELECT COUNT(1) FROM video_update")
    int countAll();

    /**
     * Records past the newest {@code keep}, by publish time. Only id and cover are populated.
     */
    @Select("SELECT id, cover FROM video_update "
            + "ORDER BY publish_time DESC, id DESC OFFSET #{keep} ROWS")
    List<VideoUpdateEntity> selectBeyondNewest(@Param("keep") int keep);

    @Delete({"<script>",
            "DELETE FROM video_update WHERE id IN",
            "<foreach collection='ids' item='id' open='(' separator=',' close=')'>",
            "#{id}",
            "</foreach>",
            "</script>"})
    int deleteByIds(@Param("ids") Collection<Long> ids);

    /** Joined with monitor, so records of deleted monitors drop out. */
    @Select("SELECT vu.id, vu.monitor_id, m.name AS monitor_name, vu.video_id, vu.video_title, "
            + "vu.publish_time, vu.cover "
            + "FROM video_update vu JOIN monitor m ON vu.monitor_id = m.id "
            + "ORDER BY vu.publish_time DESC, vu.id DESC FETCH FIRST #{limit} ROWS ONLY")
    List<RecentUpdateRow> selectRecent(@Param("limit") int limit);

    @Select("SELECT publish_time FROM video_update WHERE monitor_id = #{monitorId} ORDER BY publish_time DESC")
    List<Long> selectPublishTimes(@Param("monitorId") Long monitorId);

    @Select({"<script>",
            "SELECT monitor_id, publish_time FROM video_update WHERE monitor_id IN",
            "<foreach collection='monitorIds' item='monitorId' open='(' separator=',' close=')'>",
            "#{monitorId}",
            "</foreach>",
            "ORDER BY monitor_id, publish_time DESC",
            "</script>"})
    List<PublishTimeRow> selectPublishTimesByMonitorIds(@Param("monitorIds") Collection<Long> monitorIds);
}

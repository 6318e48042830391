package com.example.bilitracker.infrastructure.persistence.mapper;

import com.example.bilitracker.infrastructure.persistence.entity.SettingEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface SettingMapper {

    @Select("SELECT setting_key, setting_value FROM setting")
    List<SettingEntity> selectAll();

    @Update("MERGE INTO setting(setting_key, setting_value) KEY(setting_key) VALUES(#{key}, #{value})")
    int upsert(@Param("key") String key, @Param("value") String value);

    @Insert("INSERT INTO setting(setting_key, setting_value) VALUES(#{key}, #{value})")
    int insert(@Param("key") String key, @Param("value") String value);
}

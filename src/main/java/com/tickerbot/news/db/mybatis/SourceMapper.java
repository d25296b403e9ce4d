package com.tickerbot.news.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface SourceMapper {
    @Insert("INSERT INTO sources(name) VALUES(#{name}) ON CONFLICT(name) DO NOTHING")
    int insertIfAbsent(@Param("name") String name);

    @Select("SELECT id FROM sources WHERE name=#{name}")
    Long findIdByName(@Param("name") String name);
}

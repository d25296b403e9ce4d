package com.tickerbot.news.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface ArticleMapper {
    /**
     * Returns 0 when the hash already exists; the generated id is only set on insert.
     */
    @Insert("INSERT INTO articles(source_id, title, body, url, published_at, hash) " +
            "VALUES(#{sourceId}, #{title}, #{body}, #{url}, #{publishedAt}, #{hash}) " +
            "ON CONFLICT(hash) DO NOTHING")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertIfAbsent(ArticleInsertParam article);

    @Select("SELECT id FROM articles WHERE hash=#{hash}")
    @Options(flushCache = Options.FlushCachePolicy.TRUE)
    Long findIdByHash(@Param("hash") String hash);
}

package com.tickerbot.news.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.OffsetDateTime;
import java.util.List;

public interface MentionMapper {
    @Insert("INSERT INTO article_ticker(article_id, ticker_id, mention_text, mention_type, method, fused_score, confirmed) " +
            "VALUES(#{articleId}, #{tickerId}, #{mentionText}, #{mentionType}, #{method}, #{fusedScore}, #{confirmed}) " +
            "ON CONFLICT(article_id, ticker_id) DO NOTHING")
    int insertIfAbsent(MentionInsertParam mention);

    @Select("SELECT m.article_id, m.ticker_id, t.ticker AS symbol, a.source_id, a.title, a.url, a.published_at, m.fused_score " +
            "FROM article_ticker m " +
            "JOIN articles a ON a.id = m.article_id " +
            "LEFT JOIN tickers t ON t.id = m.ticker_id " +
            "WHERE m.confirmed = TRUE " +
            "AND a.published_at >= #{from} AND a.published_at < #{to} " +
            "ORDER BY m.ticker_id, a.published_at, a.id")
    List<MentionRecord> listConfirmedBetween(@Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);
}

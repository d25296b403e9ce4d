package com.tickerbot.news.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleInsertParam {
    private Long id;
    private long sourceId;
    private String title;
    private String body;
    private String url;
    private OffsetDateTime publishedAt;
    private String hash;
}

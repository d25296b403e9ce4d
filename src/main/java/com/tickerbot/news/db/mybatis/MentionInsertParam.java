package com.tickerbot.news.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MentionInsertParam {
    private long articleId;
    private long tickerId;
    private String mentionText;
    private String mentionType;
    private String method;
    private double fusedScore;
    private boolean confirmed;
}

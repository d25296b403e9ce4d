package com.tickerbot.news.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TickerRecord {
    private long id;
    private String ticker;
    private String name;
    private String aliases;
    private String description;
}

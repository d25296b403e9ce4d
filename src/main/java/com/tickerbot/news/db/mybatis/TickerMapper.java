package com.tickerbot.news.db.mybatis;

import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface TickerMapper {
    @Select("SELECT id, ticker, name, aliases, description FROM tickers ORDER BY id")
    List<TickerRecord> listTickers();
}

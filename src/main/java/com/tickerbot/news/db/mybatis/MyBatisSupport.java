package com.tickerbot.news.db.mybatis;

import org.apache.ibatis.logging.log4j2.Log4j2Impl;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.LocalCacheScope;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;

import java.sql.Connection;

public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);
        config.setLogImpl(Log4j2Impl.class);
        // Sessions live for a whole run; a session-scoped cache would serve stale hash lookups.
        config.setLocalCacheScope(LocalCacheScope.STATEMENT);

        config.addMapper(SourceMapper.class);
        config.addMapper(TickerMapper.class);
        config.addMapper(ArticleMapper.class);
        config.addMapper(MentionMapper.class);
        config.addMapper(JobsMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}

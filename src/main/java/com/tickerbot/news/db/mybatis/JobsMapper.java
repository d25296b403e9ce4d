package com.tickerbot.news.db.mybatis;

import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;

import java.time.OffsetDateTime;

public interface JobsMapper {
    @Insert("INSERT INTO jobs_log(job_type, started_at, finished_at, new_articles, duplicates, failed_articles, mentions, status, log) " +
            "VALUES(#{jobType}, #{startedAt}, #{finishedAt}, #{newArticles}, #{duplicates}, #{failedArticles}, #{mentions}, #{status}, #{log})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertJobLog(JobLogInsertParam row);

    /**
     * Takes the named lock, or steals it when the holder acquired it before {@code staleBefore}.
     * Returns 0 while a fresh holder keeps it.
     */
    @Insert("INSERT INTO jobs_lock(lock_name, owner, acquired_at) VALUES(#{lockName}, #{owner}, #{now}) " +
            "ON CONFLICT(lock_name) DO UPDATE SET owner=excluded.owner, acquired_at=excluded.acquired_at " +
            "WHERE jobs_lock.acquired_at < #{staleBefore}")
    int tryLock(@Param("lockName") String lockName,
                @Param("owner") String owner,
                @Param("now") OffsetDateTime now,
                @Param("staleBefore") OffsetDateTime staleBefore);

    @Delete("DELETE FROM jobs_lock WHERE lock_name=#{lockName} AND owner=#{owner}")
    int unlock(@Param("lockName") String lockName, @Param("owner") String owner);
}

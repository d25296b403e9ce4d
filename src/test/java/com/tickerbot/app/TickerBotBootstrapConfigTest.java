package com.tickerbot.app;

import com.tickerbot.app.properties.DbProperties;
import com.tickerbot.news.config.Config;
import com.tickerbot.news.config.PipelineSettings;
import com.tickerbot.news.fusion.FusionMode;
import com.tickerbot.news.summary.SummaryWriter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class TickerBotBootstrapConfigTest {
    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(TickerBotBootstrapConfig.class);

    @Test
    void context_shouldBindPipelineSettingsFromProperties() {
        runner.withPropertyValues(
                        "pipeline.confirm.threshold=0.9",
                        "pipeline.fusion.mode=additive",
                        "summary.zone=UTC",
                        "db.schema=news"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    PipelineSettings settings = context.getBean(PipelineSettings.class);
                    assertThat(settings.getConfirmThreshold()).isEqualTo(0.9);
                    assertThat(settings.getFusionMode()).isEqualTo(FusionMode.ADDITIVE);
                    assertThat(settings.getSummaryZone()).isEqualTo(ZoneId.of("UTC"));
                    assertThat(context.getBean(Config.class).getString("pipeline.fuzzy.floor")).isEqualTo("0.75");
                    assertThat(context.getBean(DbProperties.class).getSchema()).isEqualTo("news");
                    assertThat(context).hasSingleBean(SummaryWriter.class);
                });
    }

    @Test
    void context_shouldFailFastOnInvalidThreshold() {
        runner.withPropertyValues("pipeline.confirm.threshold=1.5")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void firstNonBlank_shouldPreferEarlierValues() {
        assertThat(TickerBotBootstrapConfig.firstNonBlank(null, " ", " jdbc:postgresql://db/x ")).isEqualTo("jdbc:postgresql://db/x");
        assertThat(TickerBotBootstrapConfig.firstNonBlank(null, "")).isEmpty();
    }
}

package com.tickerbot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private String url = "jdbc:postgresql://localhost:5432/tickerbot";
    private String user = "tickerbot";
    private String pass = "tickerbot";
    private String schema = "tickerbot";
    private boolean migrate = true;
}

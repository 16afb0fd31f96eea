package com.aicmd.cache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

// CommandStore opens its own SQLite data source once the location is resolved.
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class CommandCacheApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CommandCacheApplication.class, args)));
    }
}

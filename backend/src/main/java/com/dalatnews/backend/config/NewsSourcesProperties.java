package com.dalatnews.backend.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "news")
public class NewsSourcesProperties {
    private List<NewsSourceConfig> sources = new ArrayList<>();
}

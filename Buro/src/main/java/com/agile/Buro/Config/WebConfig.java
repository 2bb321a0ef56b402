package com.agile.Buro.Config;

import com.agile.Buro.entity.IssuePriority;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.IssueType;
import com.agile.Buro.entity.UserRole;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Query and path parameters accept the same lower-case enum values as JSON bodies.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, IssueStatus.class, IssueStatus::fromValue);
        registry.addConverter(String.class, IssuePriority.class, IssuePriority::fromValue);
        registry.addConverter(String.class, IssueType.class, IssueType::fromValue);
        registry.addConverter(String.class, UserRole.class, UserRole::fromValue);
    }
}

package dev.pagestack.service;

import dev.pagestack.engine.model.RenderContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the {@code system} namespace of the root scope from the request context.
 * User values are empty strings for anonymous visitors so that placeholders still resolve.
 */
@Service
@Slf4j
public class SystemVariableService {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm");

    private final String projectName;
    private final String defaultPlatform;
    private final ZoneId defaultZone;

    public SystemVariableService(
            @Value("${app.cms.project-name:PageStack}") String projectName,
            @Value("${app.cms.platform:web}") String defaultPlatform,
            @Value("${app.cms.timezone:UTC}") String timezone) {
        this.projectName = projectName;
        this.defaultPlatform = defaultPlatform;
        this.defaultZone = ZoneId.of(timezone);
    }

    public Map<String, Object> systemVariables(RenderContext context) {
        ZonedDateTime now = ZonedDateTime.now(context.timezone() != null ? context.timezone() : defaultZone);

        Map<String, Object> system = new LinkedHashMap<>();
        system.put("user_id", context.userId());
        system.put("user_name", orEmpty(context.userName()));
        system.put("user_email", orEmpty(context.userEmail()));
        system.put("user_code", orEmpty(context.userCode()));
        system.put("user_group", context.userGroups());
        system.put("last_login", orEmpty(context.lastLogin()));
        system.put("language", orEmpty(context.languageLocale()));
        system.put("page_keyword", orEmpty(context.pageKeyword()));
        system.put("platform", context.platform() != null ? context.platform() : defaultPlatform);
        system.put("project_name", projectName);
        system.put("current_date", now.format(DATE));
        system.put("current_datetime", now.format(DATE_TIME));
        system.put("current_time", now.format(TIME));
        return system;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}

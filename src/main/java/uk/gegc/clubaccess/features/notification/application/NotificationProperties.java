package uk.gegc.clubaccess.features.notification.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "clubaccess.notifications")
@Validated
@Data
public class NotificationProperties {

    private boolean enabled = true;

    /**
     * Recipients of admin notifications. Nothing is sent when empty.
     */
    private List<String> adminEmails = new ArrayList<>();

    private String subjectPrefix = "[Club Access]";
}

package net.modshub.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * HTTP Basic accounts and response-header settings.
 *
 * <p>An account without a password is skipped at startup; with no usable account every
 * write answers 401.</p>
 */
@Component
@ConfigurationProperties(prefix = "app.security")
@Getter
@Setter
public class ModsHubSecurityProperties {

    private Account admin = new Account("admin");

    private List<Account> users = new ArrayList<>();

    private Headers headers = new Headers();

    @Getter
    @Setter
    public static class Account {

        private String username;

        private String password;

        public Account() {
        }

        Account(String username) {
            this.username = username;
        }

        public boolean isUsable() {
            return StringUtils.hasText(username) && StringUtils.hasText(password);
        }
    }

    @Getter
    @Setter
    public static class Headers {

        private boolean contentSecurityPolicyEnabled = true;

        /**
         * Name of a {@code ReferrerPolicyHeaderWriter.ReferrerPolicy} constant.
         */
        private String referrerPolicy = "NO_REFERRER";
    }
}

package dev.haddaf.sync.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.auth.FirebaseAuth;
import java.io.IOException;
import java.io.InputStream;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

@Configuration
@EnableConfigurationProperties(FirebaseProperties.class)
public class FirebaseConfig {

    private final FirebaseProperties firebaseProperties;
    private final ResourceLoader resourceLoader;

    public FirebaseConfig(FirebaseProperties firebaseProperties, ResourceLoader resourceLoader) {
        this.firebaseProperties = firebaseProperties;
        this.resourceLoader = resourceLoader;
    }

    @Bean
    @ConditionalOnProperty(value = "firebase.enabled", havingValue = "true")
    public FirebaseApp firebaseApp() throws IOException {
        if (!StringUtils.hasText(firebaseProperties.getCredentials())) {
            throw new IllegalStateException("Firebase credentials path is required when firebase.enabled is true");
        }

        Resource resource = resourceLoader.getResource(firebaseProperties.getCredentials());
        Assert.isTrue(resource.exists(),
            () -> "Firebase credentials resource not found at " + firebaseProperties.getCredentials());

        try (InputStream inputStream = resource.getInputStream()) {
            GoogleCredentials credentials = GoogleCredentials.fromStream(inputStream);
            FirebaseOptions.Builder options = FirebaseOptions.builder()
                .setCredentials(credentials);
            if (StringUtils.hasText(firebaseProperties.getProjectId())) {
                options.setProjectId(firebaseProperties.getProjectId());
            }

            if (FirebaseApp.getApps().isEmpty()) {
                return FirebaseApp.initializeApp(options.build());
            }
            return FirebaseApp.getInstance();
        }
    }

    @Bean
    @ConditionalOnBean(FirebaseApp.class)
    public FirebaseAuth firebaseAuth(FirebaseApp firebaseApp) {
        return FirebaseAuth.getInstance(firebaseApp);
    }
}

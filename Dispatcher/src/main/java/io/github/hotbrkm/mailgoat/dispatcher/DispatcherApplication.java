package io.github.hotbrkm.mailgoat.dispatcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication(scanBasePackages = {"io.github.hotbrkm.mailgoat.dispatcher"})
public class DispatcherApplication {

    private static final String PROFILE_PROPERTY = "spring.profiles.active";
    private static final String DEFAULT_PROFILE = "default";

    public static void main(String[] args) {
        String profile = System.getProperty(PROFILE_PROPERTY, DEFAULT_PROFILE);

        ConfigurableApplicationContext context = new SpringApplicationBuilder(DispatcherApplication.class)
                .profiles(profile)
                .web(WebApplicationType.NONE)
                .logStartupInfo(false)
                .run(args);
        System.exit(SpringApplication.exit(context));
    }
}

package com.navtracker.nav;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(NavProperties.class)
public class NavConfig {
}

package com.panorama.API;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    @Value("${panorama.output-dir:panorama}")
    private String outputDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        // Serve panorama tại /panorama/** từ thư mục output
        registry.addResourceHandler("/panorama/**")
                .addResourceLocations("file:" + Paths.get(outputDir).toAbsolutePath() + "/");
    }
}

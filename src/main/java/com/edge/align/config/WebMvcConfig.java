package com.edge.align.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Web MVC 配置
 * <p>
 * 配置静态资源映射，让外部可以访问默认输出目录中的对齐结果
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private YamlConfig yamlConfig;

    /**
     * 映射规则：
     * - /api/aligned/** -> {output-dir}/
     * <p>
     * 前端访问示例：
     * - 输出路径：data/aligned/2024-01-15/home_aligned.png
     * - 访问URL：http://服务器地址/api/aligned/2024-01-15/home_aligned.png
     */
    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        YamlConfig.SystemConfig system = yamlConfig.getSystem() != null
            ? yamlConfig.getSystem() : new YamlConfig.SystemConfig();
        String location = Paths.get(system.getOutputDir()).toAbsolutePath().toUri().toString();

        registry.addResourceHandler("/api/aligned/**")
                .addResourceLocations(location);
    }
}

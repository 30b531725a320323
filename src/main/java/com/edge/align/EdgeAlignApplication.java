package com.edge.align;

import com.edge.align.config.NativeLibraryLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 图像对齐服务启动类
 */
@SpringBootApplication
public class EdgeAlignApplication {

    public static void main(String[] args) {
        // OpenCV 必须在任何 Mat 创建之前加载
        NativeLibraryLoader.loadNativeLibraries();
        SpringApplication.run(EdgeAlignApplication.class, args);
    }
}

package com.edge.align.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.ObjectSchema;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Objects;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI edgeAlignOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Edge Image Align API")
                        .description("""
                                UI 截图对齐服务 API 文档

                                ## 功能概述

                                对同一界面在不同滚动位置、视口尺寸或渲染批次下的两张截图做几何对齐，
                                输出与参考图同尺寸的对齐图，供后续像素比对使用。

                                ### 对齐策略（按级联顺序）
                                | 策略 | 执行条件 |
                                |------|----------|
                                | `opencv-feature` | 仅 method=opencv，置信度 > 0.3 直接返回 |
                                | `target-in-ref` | 目标图不大于参考图 |
                                | `ref-in-target` | 参考图不大于目标图，位移取反 |
                                | `edge-based` | 无候选或得分 > 1000 |
                                | `cropped-region` | 无候选或得分 > 5000 |
                                | `multi-scale` | 无候选或得分 > 1000 |
                                | `phase-correlation` | method=phase 或无候选 |

                                ### API 响应格式
                                所有接口返回统一的 JSON 格式：
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Edge Align Team")));
    }

    /**
     * POST 接口补充错误响应（控制器已声明的 200 示例保持不变）
     */
    @Bean
    public OpenApiCustomizer errorEnvelopeCustomizer() {
        return openApi -> openApi.getPaths().values().stream()
                .map(PathItem::getPost)
                .filter(Objects::nonNull)
                .forEach(operation -> {
                    ApiResponses responses = operation.getResponses();
                    if (!responses.containsKey("400")) {
                        responses.addApiResponse("400", errorEnvelope("参数错误或输入文件不存在",
                                "Invalid alignment method: magic"));
                    }
                    if (!responses.containsKey("500")) {
                        responses.addApiResponse("500", errorEnvelope("对齐失败（输入无法解码或输出写入失败）",
                                "Failed to write aligned image to out.png"));
                    }
                });
    }

    private static ApiResponse errorEnvelope(String description, String message) {
        Schema<?> body = new ObjectSchema()
                .addProperty("status", new StringSchema().example("error"))
                .addProperty("message", new StringSchema().example(message));
        return new ApiResponse()
                .description(description)
                .content(new Content().addMediaType("application/json", new MediaType().schema(body)));
    }
}

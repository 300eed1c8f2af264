/*
 * どこで: TTL 管理 Web 設定
 * 何を: 全管理リクエストに RequestMdcInterceptor を適用する
 * なぜ: 管理 API から起動したパスのログに呼び出し元の request_id を残すため
 */
package com.example.ttl.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
  }
}

package com.ospicorp.templog.config;

import com.ospicorp.templog.series.controller.CsvHttpMessageConverter;
import com.ospicorp.templog.series.model.SeriesPointDto;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(0, new CsvHttpMessageConverter(SeriesPointDto.class));
  }
}

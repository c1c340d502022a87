package com.scholary.diarizer.config;

import com.scholary.diarizer.audio.FfmpegProperties;
import com.scholary.diarizer.diarization.DiarizationProperties;
import com.scholary.diarizer.llm.LlmProperties;
import com.scholary.diarizer.objectstore.ObjectStoreClient;
import com.scholary.diarizer.objectstore.ObjectStoreProperties;
import com.scholary.diarizer.objectstore.S3ObjectStoreClient;
import com.scholary.diarizer.whisper.WhisperProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the pipeline and its collaborators.
 *
 * <p>Enables the property records to be loaded from application.yml and wires the clients that
 * need more than their properties to be built.
 */
@Configuration
@EnableConfigurationProperties({
  PipelineProperties.class,
  FfmpegProperties.class,
  DiarizationProperties.class,
  WhisperProperties.class,
  LlmProperties.class,
  ObjectStoreProperties.class
})
public class PipelineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}

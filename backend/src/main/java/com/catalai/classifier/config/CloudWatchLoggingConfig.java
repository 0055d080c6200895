package com.catalai.classifier.config;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.boot.logging.logback.LogbackLoggingSystem;
import org.springframework.context.annotation.Configuration;

import com.catalai.classifier.service.audit.CloudWatchLoggingService;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;

/** Attaches a Logback appender that forwards WARN and above to CloudWatch. */
@Configuration
@RequiredArgsConstructor
public class CloudWatchLoggingConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(CloudWatchLoggingConfig.class);

  private final CloudWatchLoggingService cloudWatchLoggingService;
  private final LoggingSystem loggingSystem;

  @PostConstruct
  public void configureCloudWatchLogging() {
    if (!cloudWatchLoggingService.hasAdminCredentials()
        || !(loggingSystem instanceof LogbackLoggingSystem)) {
      LOGGER.debug("CloudWatch appender not configured");
      return;
    }
    LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
    CloudWatchAppender appender = new CloudWatchAppender(cloudWatchLoggingService);
    appender.setContext(loggerContext);
    appender.start();
    loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
    LOGGER.debug("CloudWatch logging appender configured");
  }

  static final class CloudWatchAppender extends AppenderBase<ILoggingEvent> {

    private final CloudWatchLoggingService service;

    CloudWatchAppender(CloudWatchLoggingService service) {
      this.service = service;
    }

    @Override
    protected void append(ILoggingEvent event) {
      // Avoid recursion through the shipping client.
      if (!event.getLevel().isGreaterOrEqual(Level.WARN)
          || event.getLoggerName().contains("CloudWatch")) {
        return;
      }
      Map<String, Object> data = new HashMap<>();
      data.put("logger", event.getLoggerName());
      data.put("thread", event.getThreadName());
      if (event.getThrowableProxy() != null) {
        data.put("exception", event.getThrowableProxy().getClassName());
        data.put("exceptionMessage", event.getThrowableProxy().getMessage());
      }
      Map<String, String> mdc = event.getMDCPropertyMap();
      if (mdc.get("username") != null) {
        data.put("username", mdc.get("username"));
      }
      if (mdc.get("caseId") != null) {
        data.put("caseId", mdc.get("caseId"));
      }
      service.log(event.getLevel().toString(), event.getFormattedMessage(), data);
    }
  }
}

package com.opsbrief.insights.config;

import com.opsbrief.insights.analytics.AnalysisObserver;
import com.opsbrief.insights.analytics.IqrDetector;
import com.opsbrief.insights.analytics.LoggingAnalysisObserver;
import com.opsbrief.insights.analytics.SeasonalDecomposer;
import com.opsbrief.insights.analytics.TrendAnalyzer;
import com.opsbrief.insights.analytics.ZScoreDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalyticsConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsConfig.class);

    @Bean
    public AnalysisObserver analysisObserver() {
        return new LoggingAnalysisObserver();
    }

    @Bean
    public ZScoreDetector zScoreDetector(InsightsProperties properties, AnalysisObserver observer) {
        InsightsProperties.ZScore config = properties.zScore();
        log.info("Analytics: z-score detector threshold={} minSamples={}", config.threshold(), config.minSamples());
        return new ZScoreDetector(config.threshold(), config.minSamples(), observer);
    }

    @Bean
    public IqrDetector iqrDetector(InsightsProperties properties, AnalysisObserver observer) {
        InsightsProperties.Iqr config = properties.iqr();
        log.info("Analytics: IQR detector multiplier={} minSamples={}", config.multiplier(), config.minSamples());
        return new IqrDetector(config.multiplier(), config.minSamples(), observer);
    }

    @Bean
    public TrendAnalyzer trendAnalyzer(InsightsProperties properties, AnalysisObserver observer) {
        return new TrendAnalyzer(properties.trend().toPolicy(), observer);
    }

    @Bean
    public SeasonalDecomposer seasonalDecomposer(InsightsProperties properties, AnalysisObserver observer) {
        InsightsProperties.Seasonal config = properties.seasonal();
        return new SeasonalDecomposer(config.period(), config.residualThreshold(), observer);
    }
}

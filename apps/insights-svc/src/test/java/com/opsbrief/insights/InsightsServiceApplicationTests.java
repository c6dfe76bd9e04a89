package com.opsbrief.insights;

import static org.assertj.core.api.Assertions.assertThat;

import com.opsbrief.insights.analytics.MetricAnalysisService;
import com.opsbrief.insights.analytics.SeasonalDecomposer;
import com.opsbrief.insights.analytics.TrendAnalyzer;
import com.opsbrief.insights.analytics.ZScoreDetector;
import com.opsbrief.insights.model.MetricAnalysis;
import com.opsbrief.insights.model.MetricSeries;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class InsightsServiceApplicationTests {

    @Autowired
    ZScoreDetector zScoreDetector;

    @Autowired
    SeasonalDecomposer seasonalDecomposer;

    @Autowired
    TrendAnalyzer trendAnalyzer;

    @Autowired
    MetricAnalysisService analysisService;

    @Test
    void bindsAnalyzerSettingsFromProfile() {
        assertThat(zScoreDetector.getThreshold()).isEqualTo(2.5);
        assertThat(zScoreDetector.getMinSamples()).isEqualTo(10);
        assertThat(seasonalDecomposer.getPeriod()).isEqualTo(4);
        assertThat(trendAnalyzer.getPolicy().minSamples()).isEqualTo(7);
    }

    @Test
    void analysisServiceIsWired() {
        MetricAnalysis analysis = analysisService.analyze(MetricSeries.of(
                10, 12, 11, 13, 12, 10, 11, 12, 13, 10, 12, 11, 13, 12, 10, 11, 12, 13, 11, 100));

        assertThat(analysis.sampleCount()).isEqualTo(20);
        assertThat(analysis.anomalies()).isNotEmpty();
        assertThat(analysis.anomalies().get(0).index()).isEqualTo(19);
    }
}

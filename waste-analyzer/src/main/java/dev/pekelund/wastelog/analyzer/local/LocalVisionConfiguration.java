package dev.pekelund.wastelog.analyzer.local;

import dev.pekelund.wastelog.analyzer.WasteImageAnalyzer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("local")
public class LocalVisionConfiguration {

    @Bean
    public WasteImageAnalyzer wasteImageAnalyzer() {
        return new StubWasteImageAnalyzer();
    }
}

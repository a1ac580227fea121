package dev.pekelund.wastelog.analyzer;

import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModules;

class ModularityVerificationTests {

    @Test
    void modulesShouldRespectDeclaredBoundaries() {
        ApplicationModules.of(WasteAnalyzerApplication.class).verify();
    }
}

package win.ixuni.quarry.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import win.ixuni.quarry.core.retrieval.RetrievalEngine;

@Configuration
public class RetrievalConfig {

    @Bean
    public RetrievalEngine retrievalEngine() {
        return new RetrievalEngine();
    }
}

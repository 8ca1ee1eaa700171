package com.architecture.codeflow.config;

import com.architecture.codeflow.dto.FlowchartOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default flowchart options, read from the {@code flowchart.*} keys of application.yml.
 * Requests may override each flag.
 */
@Configuration
@Slf4j
public class FlowchartConfig {

    @Value("${flowchart.simplify:true}")
    private boolean simplify;

    @Value("${flowchart.align-consecutive-conditions:false}")
    private boolean alignConsecutiveConditions;

    @Bean
    public FlowchartOptions defaultFlowchartOptions() {
        log.info("Flowchart defaults: simplify={}, alignConsecutiveConditions={}", simplify, alignConsecutiveConditions);
        return FlowchartOptions.builder()
                .simplify(simplify)
                .alignConsecutiveConditions(alignConsecutiveConditions)
                .build();
    }
}

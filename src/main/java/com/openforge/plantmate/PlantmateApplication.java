package com.openforge.plantmate;

import com.openforge.plantmate.agent.OrchestratorProperties;
import com.openforge.plantmate.gpu.GpuProperties;
import com.openforge.plantmate.gpu.ModelRoleProperties;
import com.openforge.plantmate.llm.LlmProperties;
import com.openforge.plantmate.stream.StreamProperties;
import com.openforge.plantmate.tool.ToolCatalogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        LlmProperties.class,
        OrchestratorProperties.class,
        StreamProperties.class,
        GpuProperties.class,
        ModelRoleProperties.class,
        ToolCatalogProperties.class
})
public class PlantmateApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlantmateApplication.class, args);
    }
}

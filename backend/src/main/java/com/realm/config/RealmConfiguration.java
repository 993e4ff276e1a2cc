package com.realm.config;

import com.realm.generator.template.TemplateStore;
import com.realm.simulation.persistence.StateManager;
import com.realm.simulation.time.CallbackPolicy;
import com.realm.simulation.world.SimulationSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Paths;

/**
 * 生成与模拟相关配置
 */
@Configuration
public class RealmConfiguration {

    @Value("${realm.data-location:classpath:data/}")
    private String dataLocation;

    @Value("${realm.seed:#{null}}")
    private Long seed;

    @Value("${realm.save-dir:saves}")
    private String saveDir;

    @Value("${realm.world.name:New World}")
    private String worldName;

    @Value("${realm.world.locations:5}")
    private int worldLocations;

    @Value("${realm.event.max-history:1000}")
    private int maxHistory;

    @Value("${realm.time.callback-policy:EXACT_TICK}")
    private CallbackPolicy callbackPolicy;

    @Bean
    public TemplateStore templateStore(ResourceLoader resourceLoader) {
        return TemplateStore.load(resourceLoader, dataLocation);
    }

    @Bean
    public StateManager stateManager() {
        return new StateManager(Paths.get(saveDir));
    }

    @Bean
    public SimulationSettings simulationSettings() {
        return SimulationSettings.builder()
            .worldName(worldName)
            .locationCount(worldLocations)
            .maxHistory(maxHistory)
            .callbackPolicy(callbackPolicy)
            .build();
    }

    public String getDataLocation() { return dataLocation; }
    public Long getSeed() { return seed; }
    public String getSaveDir() { return saveDir; }
    public String getWorldName() { return worldName; }
    public int getWorldLocations() { return worldLocations; }
    public int getMaxHistory() { return maxHistory; }
    public CallbackPolicy getCallbackPolicy() { return callbackPolicy; }
}

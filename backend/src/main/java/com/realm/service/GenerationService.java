package com.realm.service;

import com.realm.config.RealmConfiguration;
import com.realm.generator.ContentGenerator;
import com.realm.generator.RandomSource;
import com.realm.generator.model.GeneratedLocation;
import com.realm.generator.model.GeneratedNpc;
import com.realm.generator.model.GeneratedWorld;
import com.realm.generator.model.Item;
import com.realm.generator.model.ItemConstraints;
import com.realm.generator.template.TemplateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 内容生成服务
 *
 * 进程内唯一的生成上下文，由 Spring 构造后注入各控制器。
 * 生成核心是单线程的，这里用 synchronized 串行化访问。
 */
@Service
@Slf4j
public class GenerationService {

    private final TemplateStore templates;
    private ContentGenerator generator;

    public GenerationService(TemplateStore templates, RealmConfiguration configuration) {
        this.templates = templates;
        this.generator = new ContentGenerator(templates, RandomSource.fromSeed(configuration.getSeed()));
        log.info("🎲 生成服务就绪, seed={}", generator.getRandom().getSeed());
    }

    public synchronized Item generateItem(String template, ItemConstraints constraints) {
        log.debug("生成物品: template={}, constraints={}", template, constraints);
        return generator.generateItem(template, constraints);
    }

    public synchronized List<Item> generateItemsFromSet(String setName, Integer count) {
        return generator.generateItemsFromSet(setName, count);
    }

    public synchronized GeneratedNpc generateNpc(List<String> professions, String race, String faction) {
        log.debug("生成NPC: professions={}, race={}, faction={}", professions, race, faction);
        return generator.generateNpc(professions, race, faction);
    }

    public synchronized GeneratedLocation generateLocation(String template, boolean connect, int maxConnections, String biome) {
        return generator.generateLocation(template, connect, maxConnections, biome);
    }

    public synchronized GeneratedWorld generateWorld(int count) {
        log.info("生成世界: 根地点数={}", count);
        return generator.generateWorld(count);
    }

    /**
     * 用新种子重建生成器，之后的输出从新随机流开始
     */
    public synchronized long reseed(Long seed) {
        generator = new ContentGenerator(templates, RandomSource.fromSeed(seed));
        log.info("生成器已重置, seed={}", generator.getRandom().getSeed());
        return generator.getRandom().getSeed();
    }

    public synchronized long getSeed() {
        return generator.getRandom().getSeed();
    }

    public List<String> getItemTemplateNames() {
        return new ArrayList<>(templates.getItemTemplates().keySet());
    }

    public List<String> getProfessionNames() {
        return new ArrayList<>(templates.getProfessions().keySet());
    }

    public List<String> getLocationTemplateNames() {
        return new ArrayList<>(templates.getLocationTemplates().keySet());
    }
}

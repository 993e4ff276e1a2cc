package com.realm.controller;

import com.realm.common.Result;
import com.realm.dto.GenerateItemRequest;
import com.realm.dto.GenerateLocationRequest;
import com.realm.dto.GenerateNpcRequest;
import com.realm.generator.model.GeneratedLocation;
import com.realm.generator.model.GeneratedNpc;
import com.realm.generator.model.GeneratedWorld;
import com.realm.generator.model.Item;
import com.realm.service.GenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内容生成Controller
 * 物品、NPC、地点和世界的一次性生成，不进入模拟
 */
@RestController
@RequestMapping("/generate")
@Validated
@CrossOrigin(originPatterns = {"http://localhost:*", "http://127.0.0.1:*"}, allowCredentials = "true")
public class GenerationController {

    private static final Logger logger = LoggerFactory.getLogger(GenerationController.class);

    private final GenerationService generationService;

    @Autowired
    public GenerationController(GenerationService generationService) {
        this.generationService = generationService;
    }

    @PostMapping("/item")
    public Result<Item> generateItem(@Valid @RequestBody GenerateItemRequest request) {
        return Result.success(generationService.generateItem(request.getTemplate(), request.toConstraints()));
    }

    @GetMapping("/item-set/{name}")
    public Result<List<Item>> generateItemSet(@PathVariable String name,
                                              @RequestParam(required = false) @Min(1) @Max(50) Integer count) {
        return Result.success(generationService.generateItemsFromSet(name, count));
    }

    @PostMapping("/npc")
    public Result<GeneratedNpc> generateNpc(@RequestBody(required = false) GenerateNpcRequest request) {
        GenerateNpcRequest body = request != null ? request : new GenerateNpcRequest();
        return Result.success(generationService.generateNpc(body.getProfessions(), body.getRace(), body.getFaction()));
    }

    @PostMapping("/location")
    public Result<GeneratedLocation> generateLocation(@Valid @RequestBody GenerateLocationRequest request) {
        return Result.success(generationService.generateLocation(
            request.getTemplate(), request.isConnect(), request.getMaxConnections(), request.getBiome()));
    }

    @PostMapping("/world")
    public Result<GeneratedWorld> generateWorld(@RequestParam(defaultValue = "5") @Min(0) @Max(100) int locations) {
        GeneratedWorld world = generationService.generateWorld(locations);
        logger.info("生成世界完成: {} 个地点", world.getLocations().size());
        return Result.success(world);
    }

    @PostMapping("/seed")
    public Result<Map<String, Object>> reseed(@RequestParam(required = false) Long seed) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seed", generationService.reseed(seed));
        return Result.success("生成器已重置", data);
    }

    /**
     * 可用模板名称
     */
    @GetMapping("/templates")
    public Result<Map<String, List<String>>> templates() {
        Map<String, List<String>> data = new LinkedHashMap<>();
        data.put("items", generationService.getItemTemplateNames());
        data.put("professions", generationService.getProfessionNames());
        data.put("locations", generationService.getLocationTemplateNames());
        return Result.success(data);
    }
}

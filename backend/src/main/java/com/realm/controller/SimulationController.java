package com.realm.controller;

import com.realm.common.Result;
import com.realm.dto.CreateWorldRequest;
import com.realm.dto.LocationView;
import com.realm.dto.NpcView;
import com.realm.dto.SaveRequest;
import com.realm.dto.SpawnNpcRequest;
import com.realm.dto.StepRequest;
import com.realm.dto.StepResult;
import com.realm.service.SimulationService;
import com.realm.simulation.event.EventRecord;
import com.realm.simulation.persistence.SaveInfo;
import com.realm.simulation.world.SimulationStatistics;
import com.realm.simulation.world.WorldSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 世界模拟Controller
 */
@Slf4j
@RestController
@RequestMapping("/world")
@Validated
@CrossOrigin(originPatterns = {"http://localhost:*", "http://127.0.0.1:*"}, allowCredentials = "true")
public class SimulationController {

    private final SimulationService simulationService;

    @Autowired
    public SimulationController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @PostMapping
    public Result<WorldSummary> createWorld(@Valid @RequestBody(required = false) CreateWorldRequest request) {
        CreateWorldRequest body = request != null ? request : new CreateWorldRequest();
        return Result.success("世界已创建",
            simulationService.createWorld(body.getName(), body.getLocations(), body.getSeed()));
    }

    @GetMapping
    public Result<WorldSummary> summary() {
        return Result.success(simulationService.getSummary());
    }

    @PostMapping("/step")
    public Result<StepResult> step(@Valid @RequestBody(required = false) StepRequest request) {
        StepRequest body = request != null ? request : new StepRequest();
        return Result.success(simulationService.step(body.getMinutes(), body.getSteps()));
    }

    @GetMapping("/statistics")
    public Result<SimulationStatistics> statistics() {
        return Result.success(simulationService.getStatistics());
    }

    @GetMapping("/locations")
    public Result<List<LocationView>> locations() {
        return Result.success(simulationService.listLocations());
    }

    @GetMapping("/locations/{id}")
    public Result<LocationView> location(@PathVariable String id) {
        return Result.success(simulationService.getLocation(id));
    }

    @GetMapping("/npcs")
    public Result<List<NpcView>> npcs(@RequestParam(required = false) String locationId) {
        return Result.success(simulationService.listNpcs(locationId));
    }

    @GetMapping("/npcs/{id}")
    public Result<NpcView> npc(@PathVariable String id) {
        return Result.success(simulationService.getNpc(id));
    }

    @PostMapping("/npcs")
    public Result<NpcView> spawn(@Valid @RequestBody SpawnNpcRequest request) {
        NpcView npc = simulationService.spawnNpc(request.getLocationId(), request.getProfessions(), request.getRace());
        log.info("通过接口生成NPC: {} @ {}", npc.getName(), request.getLocationId());
        return Result.success(npc);
    }

    @DeleteMapping("/npcs/{id}")
    public Result<Void> remove(@PathVariable String id) {
        simulationService.removeNpc(id);
        return Result.success("NPC已移除", null);
    }

    @PostMapping("/npcs/{id}/move")
    public Result<NpcView> move(@PathVariable String id, @RequestParam String locationId) {
        return Result.success(simulationService.moveNpc(id, locationId));
    }

    @GetMapping("/events")
    public Result<List<EventRecord>> events(@RequestParam(required = false) String type,
                                            @RequestParam(defaultValue = "20") @Min(1) @Max(1000) int limit) {
        return Result.success(simulationService.recentEvents(type, limit));
    }

    @PostMapping("/save")
    public Result<Map<String, Object>> save(@Valid @RequestBody SaveRequest request) throws IOException {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", request.getName());
        data.put("path", simulationService.save(request.getName(), request.getFormat(), request.isCompressed()));
        return Result.success("存档成功", data);
    }

    @PostMapping("/load")
    public Result<WorldSummary> load(@RequestParam String name,
                                     @RequestParam(required = false) String format) throws IOException {
        return Result.success("读档成功", simulationService.load(name, format));
    }

    @GetMapping("/saves")
    public Result<List<SaveInfo>> saves() throws IOException {
        return Result.success(simulationService.listSaves());
    }

    @DeleteMapping("/saves/{name}")
    public Result<Boolean> deleteSave(@PathVariable String name) throws IOException {
        return Result.success(simulationService.deleteSave(name));
    }
}

package com.solo.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * REST контроллер одиночного приключения.
 * Все игровые операции привязаны к session_id.
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
@Tag(name = "Game API", description = "Кампании, персонажи и пошаговые действия")
public class GameApiController {

    @Autowired
    private AdventureService adventureService;

    /**
     * GET /api/health - Проверка здоровья сервера
     */
    @Operation(summary = "Проверка здоровья сервера", description = "Возвращает статус работы сервера")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Сервер работает")
    })
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "ok");
        health.put("service", "Solo Adventure");
        health.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(health);
    }

    @Operation(summary = "Список кампаний", description = "Кампании и доступные в них спутники")
    @GetMapping("/campaigns")
    public ResponseEntity<Map<String, Object>> listCampaigns() {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("campaigns", adventureService.listCampaigns());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Реестр персонажей", description = "Имена сохранённых персонажей по алфавиту")
    @GetMapping("/characters")
    public ResponseEntity<Map<String, Object>> listCharacters() {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("characters", adventureService.listCharacters());
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/games - Создать игру
     */
    @Operation(summary = "Создать игру", description = "Новый персонаж (character) или персонаж из реестра (roster_name)")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Игра создана"),
        @ApiResponse(responseCode = "400", description = "Неверные параметры")
    })
    @PostMapping("/games")
    public ResponseEntity<Map<String, Object>> createGame(@RequestBody Map<String, Object> body) {
        Map<String, Object> response = new HashMap<>(adventureService.createGame(body));
        response.put("success", true);
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Состояние игры")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Сводка состояния"),
        @ApiResponse(responseCode = "404", description = "Игра не найдена"),
        @ApiResponse(responseCode = "409", description = "Сохранение повреждено")
    })
    @GetMapping("/games/{sessionId}")
    public ResponseEntity<Map<String, Object>> getGame(@PathVariable String sessionId) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("game", adventureService.getStatus(sessionId));
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/games/{sessionId}/actions - Один ход игрока
     */
    @Operation(summary = "Действие игрока", description = "Разрешает одно действие, сохраняет игру и возвращает повествование")
    @PostMapping("/games/{sessionId}/actions")
    public ResponseEntity<Map<String, Object>> performAction(
            @PathVariable String sessionId,
            @RequestBody Map<String, Object> body) {
        Object action = body == null ? null : body.get("action");
        if (action == null || action.toString().isBlank()) {
            Map<String, Object> error = new HashMap<>();
            error.put("success", false);
            error.put("error", "Field 'action' is required");
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
        }
        Map<String, Object> response = new HashMap<>(adventureService.performAction(sessionId, action.toString()));
        response.put("success", true);
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/games/{sessionId}/decisions - Выбор после повышения уровня
     */
    @Operation(summary = "Разрешить отложенное решение", description = "index - позиция в очереди, choice - название заклинания")
    @PostMapping("/games/{sessionId}/decisions")
    public ResponseEntity<Map<String, Object>> resolveDecision(
            @PathVariable String sessionId,
            @RequestBody Map<String, Object> body) {
        Object index = body == null ? null : body.get("index");
        Object choice = body == null ? null : body.get("choice");
        if (!(index instanceof Number) || choice == null) {
            Map<String, Object> error = new HashMap<>();
            error.put("success", false);
            error.put("error", "Fields 'index' and 'choice' are required");
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
        }
        Map<String, Object> response = new HashMap<>(
            adventureService.resolveDecision(sessionId, ((Number) index).intValue(), choice.toString()));
        response.put("success", true);
        return ResponseEntity.ok(response);
    }
}

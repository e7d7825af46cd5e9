package com.tony.propsAnalytics.controller;

import com.tony.propsAnalytics.model.StatCategory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/v1/references")
public class ReferenceController {

    @GetMapping("/stat-categories")
    public ResponseEntity<List<StatCategory>> getStatCategories(@RequestParam(defaultValue = "ALL") String filter) {
        // "ALL", "SINGLE" (stats simples) ou "COMBO" (combinaisons)
        List<StatCategory> categories = Arrays.stream(StatCategory.values())
                .filter(c -> switch (filter.toUpperCase()) {
                    case "SINGLE" -> !c.isCombination();
                    case "COMBO" -> c.isCombination();
                    default -> true;
                })
                .toList();
        return ResponseEntity.ok(categories);
    }

    @GetMapping("/stat-categories/{code}")
    public ResponseEntity<StatCategory> getStatCategory(@PathVariable String code) {
        return StatCategory.fromCode(code)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}

package com.calmtable.restaurant.controller;

import com.calmtable.restaurant.dto.MenuItemDto;
import com.calmtable.restaurant.model.MenuCategory;
import com.calmtable.restaurant.service.MenuService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/menu")
public class MenuController {

    private final MenuService menuService;

    public MenuController(MenuService menuService) {
        this.menuService = menuService;
    }

    @GetMapping
    public ResponseEntity<List<MenuItemDto>> list(@RequestParam(required = false) String category,
                                                  @RequestParam(name = "dietary_tag", required = false) String dietaryTag) {
        return ResponseEntity.ok(menuService.listMenu(MenuCategory.fromJson(category), dietaryTag));
    }

    @GetMapping("/featured")
    public ResponseEntity<List<MenuItemDto>> featured() {
        return ResponseEntity.ok(menuService.featured());
    }

    @GetMapping("/best-ordered")
    public ResponseEntity<List<MenuItemDto>> bestOrdered() {
        return ResponseEntity.ok(menuService.bestOrdered());
    }

    @GetMapping("/{id}")
    public ResponseEntity<MenuItemDto> get(@PathVariable Long id) {
        return ResponseEntity.ok(menuService.getItem(id));
    }
}

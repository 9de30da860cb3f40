package com.calmtable.restaurant.repository;

import com.calmtable.restaurant.model.MenuCategory;
import com.calmtable.restaurant.model.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MenuItemRepository extends JpaRepository<MenuItem, Long> {
    List<MenuItem> findAllByOrderByCategoryAscNameAsc();
    List<MenuItem> findByAvailableTrueOrderByCategoryAscNameAsc();
    List<MenuItem> findByCategoryAndAvailableTrueOrderByNameAsc(MenuCategory category);
    List<MenuItem> findByFeaturedTrueAndAvailableTrueOrderByNameAsc();
    boolean existsByNameIgnoreCase(String name);
}

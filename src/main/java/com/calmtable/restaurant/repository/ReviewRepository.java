package com.calmtable.restaurant.repository;

import com.calmtable.restaurant.model.Review;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReviewRepository extends JpaRepository<Review, Long> {
    boolean existsByMenuItemIdAndUserId(Long menuItemId, Long userId);
    List<Review> findByMenuItemIdOrderByCreatedAtDescIdDesc(Long menuItemId);
    List<Review> findAllByOrderByCreatedAtDescIdDesc();

    @Query("SELECT r.menuItemId, AVG(r.rating) FROM Review r GROUP BY r.menuItemId")
    List<Object[]> averageRatingByMenuItem();
}

package com.calmtable.restaurant.repository;

import com.calmtable.restaurant.model.Order;
import com.calmtable.restaurant.model.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface OrderRepository extends JpaRepository<Order, Long> {
    Optional<Order> findFirstByUserIdAndStatusOrderByCreatedAtDescIdDesc(Long userId, OrderStatus status);
    List<Order> findByUserIdAndStatus(Long userId, OrderStatus status);
    List<Order> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);
    List<Order> findAllByOrderByCreatedAtDescIdDesc();
    List<Order> findByStatusIn(Collection<OrderStatus> statuses);
    long countByStatus(OrderStatus status);
    boolean existsByOrderNumber(String orderNumber);
    List<Order> findByCreatedAtGreaterThanEqual(LocalDateTime since);
}

package com.calmtable.restaurant.repository;

import com.calmtable.restaurant.model.AdminNotification;
import com.calmtable.restaurant.model.NotificationType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AdminNotificationRepository extends JpaRepository<AdminNotification, Long> {
    boolean existsByRecipientIdAndEventKeyAndType(Long recipientId, String eventKey, NotificationType type);
    List<AdminNotification> findByRecipientIdOrderByCreatedAtDescIdDesc(Long recipientId);
    List<AdminNotification> findByRecipientIdAndReadFalse(Long recipientId);
    List<AdminNotification> findByRecipientIdAndType(Long recipientId, NotificationType type);
    Optional<AdminNotification> findByIdAndRecipientId(Long id, Long recipientId);
    long countByRecipientIdAndReadFalse(Long recipientId);
}

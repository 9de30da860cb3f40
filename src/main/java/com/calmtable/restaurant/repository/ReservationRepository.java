package com.calmtable.restaurant.repository;

import com.calmtable.restaurant.model.Reservation;
import com.calmtable.restaurant.model.ReservationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    long countByDateAndTimeSlotAndStatusIn(LocalDate date, LocalTime timeSlot, Collection<ReservationStatus> statuses);

    List<Reservation> findByDateAndStatusIn(LocalDate date, Collection<ReservationStatus> statuses);

    Optional<Reservation> findByConfirmationCode(String confirmationCode);

    boolean existsByConfirmationCode(String confirmationCode);

    @Query("SELECT r FROM Reservation r WHERE r.userId = :userId OR LOWER(r.email) = LOWER(:email) " +
            "ORDER BY r.createdAt DESC, r.id DESC")
    List<Reservation> findOwnedOrMatchingEmail(@Param("userId") Long userId, @Param("email") String email);

    @Query("SELECT r FROM Reservation r WHERE (r.userId = :userId OR LOWER(r.email) = LOWER(:email)) " +
            "AND r.status = :status AND r.date <= :today")
    List<Reservation> findCandidatesForReview(@Param("userId") Long userId,
                                              @Param("email") String email,
                                              @Param("status") ReservationStatus status,
                                              @Param("today") LocalDate today);

    List<Reservation> findAllByOrderByDateDescTimeSlotDesc();

    List<Reservation> findByDateOrderByTimeSlotAsc(LocalDate date);

    List<Reservation> findByStatusOrderByDateDescTimeSlotDesc(ReservationStatus status);

    long countByDate(LocalDate date);

    List<Reservation> findByDateBetween(LocalDate from, LocalDate to);
}

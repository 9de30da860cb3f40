package com.calmtable.restaurant.service;

import com.calmtable.restaurant.exception.AuthenticationRequiredException;
import com.calmtable.restaurant.exception.DuplicateReviewException;
import com.calmtable.restaurant.exception.ForbiddenRoleException;
import com.calmtable.restaurant.exception.NotFoundException;
import com.calmtable.restaurant.exception.ReviewNotAllowedException;
import com.calmtable.restaurant.exception.ValidationException;
import com.calmtable.restaurant.model.Reservation;
import com.calmtable.restaurant.model.ReservationStatus;
import com.calmtable.restaurant.model.Review;
import com.calmtable.restaurant.model.User;
import com.calmtable.restaurant.repository.MenuItemRepository;
import com.calmtable.restaurant.repository.ReservationRepository;
import com.calmtable.restaurant.repository.ReviewRepository;
import com.calmtable.restaurant.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReviewServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T18:10:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    @Mock
    private ReviewRepository reviewRepository;
    @Mock
    private ReservationRepository reservationRepository;
    @Mock
    private MenuItemRepository menuItemRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private PlatformTransactionManager transactionManager;

    private ReviewService service;
    private User customer;

    @BeforeEach
    void setUp() {
        LockedTransactionRunner runner = new LockedTransactionRunner(new KeyedLockRegistry(), transactionManager, 3, 1);
        service = new ReviewService(reviewRepository, reservationRepository, menuItemRepository,
                new CallerResolver(userRepository), runner, CLOCK);

        customer = new User();
        customer.setId(3L);
        customer.setEmail("regular@calmtable.test");
        customer.setRole(User.ROLE_CUSTOMER);
        when(userRepository.findById(3L)).thenReturn(Optional.of(customer));
        when(menuItemRepository.existsById(20L)).thenReturn(true);
        when(reviewRepository.save(any(Review.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private void visits(Reservation... reservations) {
        when(reservationRepository.findCandidatesForReview(eq(3L), eq("regular@calmtable.test"),
                eq(ReservationStatus.CONFIRMED), eq(TODAY))).thenReturn(List.of(reservations));
    }

    private static Reservation confirmed(LocalDate date, String slot) {
        Reservation reservation = new Reservation();
        reservation.setDate(date);
        reservation.setTimeSlot(LocalTime.parse(slot));
        reservation.setStatus(ReservationStatus.CONFIRMED);
        return reservation;
    }

    @Test
    void pastConfirmedVisitMakesCustomerEligible() {
        visits(confirmed(TODAY.minusDays(2), "19:00"));

        assertThat(service.canReview(3L)).isTrue();
    }

    @Test
    void visitLaterTodayDoesNotCountYet() {
        visits(confirmed(TODAY, "19:00"));

        assertThat(service.canReview(3L)).isFalse();
    }

    @Test
    void visitThatStartedEarlierTodayCounts() {
        visits(confirmed(TODAY, "17:30"));

        assertThat(service.canReview(3L)).isTrue();
    }

    @Test
    void anonymousAndUnknownCallersAreNotEligible() {
        assertThat(service.canReview(null)).isFalse();
        assertThat(service.canReview(404L)).isFalse();
    }

    @Test
    void staffAreNeverEligible() {
        User staff = new User();
        staff.setId(4L);
        staff.setEmail("chef@calmtable.test");
        staff.setRole(User.ROLE_EMPLOYEE);
        when(userRepository.findById(4L)).thenReturn(Optional.of(staff));
        when(reservationRepository.findCandidatesForReview(eq(4L), anyString(), any(), any()))
                .thenReturn(List.of(confirmed(TODAY.minusDays(1), "19:00")));

        assertThat(service.canReview(4L)).isFalse();
        assertThrows(ReviewNotAllowedException.class, () -> service.createReview(4L, 20L, 5, "great"));
    }

    @Test
    void eligibleCustomerCanReviewOnce() {
        visits(confirmed(TODAY.minusDays(2), "19:00"));

        Review review = service.createReview(3L, 20L, 4, "  Lovely risotto ");

        assertThat(review.getRating()).isEqualTo(4);
        assertThat(review.getComment()).isEqualTo("Lovely risotto");
        assertThat(review.getUserId()).isEqualTo(3L);
    }

    @Test
    void customerWithoutVisitIsRefused() {
        visits();

        ReviewNotAllowedException error = assertThrows(ReviewNotAllowedException.class,
                () -> service.createReview(3L, 20L, 5, null));
        assertThat(error.getCode()).isEqualTo("REVIEW_NOT_ALLOWED");
        verify(reviewRepository, never()).save(any());
    }

    @Test
    void secondReviewOfSameItemIsDuplicate() {
        visits(confirmed(TODAY.minusDays(2), "19:00"));
        when(reviewRepository.existsByMenuItemIdAndUserId(20L, 3L)).thenReturn(true);

        assertThrows(DuplicateReviewException.class, () -> service.createReview(3L, 20L, 5, "again"));
    }

    @Test
    void uniqueConstraintRaceIsReportedAsDuplicate() {
        visits(confirmed(TODAY.minusDays(2), "19:00"));
        when(reviewRepository.save(any(Review.class))).thenThrow(new DataIntegrityViolationException("uk_reviews_menu_item_user"));

        assertThrows(DuplicateReviewException.class, () -> service.createReview(3L, 20L, 5, "race"));
    }

    @Test
    void ratingOutOfRangeAndMissingItemAreRejected() {
        visits(confirmed(TODAY.minusDays(2), "19:00"));

        assertThrows(ValidationException.class, () -> service.createReview(3L, 20L, 6, null));
        assertThrows(ValidationException.class, () -> service.createReview(3L, 20L, 0, null));
        assertThrows(NotFoundException.class, () -> service.createReview(3L, 21L, 5, null));
        assertThrows(AuthenticationRequiredException.class, () -> service.createReview(null, 20L, 5, null));
    }

    @Test
    void onlyAuthorOrStaffMayDeleteReview() {
        Review review = new Review();
        review.setId(9L);
        review.setUserId(77L);
        when(reviewRepository.findById(9L)).thenReturn(Optional.of(review));

        assertThrows(ForbiddenRoleException.class, () -> service.deleteReview(3L, 9L));

        review.setUserId(3L);
        service.deleteReview(3L, 9L);
        verify(reviewRepository).delete(review);
    }
}

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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
public class ReviewService {

    private static final Logger logger = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewRepository reviewRepository;
    private final ReservationRepository reservationRepository;
    private final MenuItemRepository menuItemRepository;
    private final CallerResolver callerResolver;
    private final LockedTransactionRunner transactionRunner;
    private final Clock clock;

    public ReviewService(ReviewRepository reviewRepository,
                         ReservationRepository reservationRepository,
                         MenuItemRepository menuItemRepository,
                         CallerResolver callerResolver,
                         LockedTransactionRunner transactionRunner,
                         Clock clock) {
        this.reviewRepository = reviewRepository;
        this.reservationRepository = reservationRepository;
        this.menuItemRepository = menuItemRepository;
        this.callerResolver = callerResolver;
        this.transactionRunner = transactionRunner;
        this.clock = clock;
    }

    /**
     * A customer may review once they have a confirmed reservation whose slot has already started,
     * either owned by their account or booked under their e-mail address.
     */
    public boolean canReview(Long callerId) {
        if (callerId == null) {
            return false;
        }
        User user;
        try {
            user = callerResolver.requireUser(callerId);
        } catch (AuthenticationRequiredException e) {
            return false;
        }
        return !user.isStaff() && hasPastConfirmedVisit(user);
    }

    private boolean hasPastConfirmedVisit(User user) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Reservation> candidates = reservationRepository.findCandidatesForReview(
                user.getId(), user.getEmail(), ReservationStatus.CONFIRMED, now.toLocalDate());
        return candidates.stream().anyMatch(reservation -> reservation.hasStartedBy(now));
    }

    public Review createReview(Long callerId, Long menuItemId, Integer rating, String comment) {
        User user = callerResolver.requireUser(callerId);
        if (rating == null || rating < Review.MIN_RATING || rating > Review.MAX_RATING) {
            throw new ValidationException("Rating must be between " + Review.MIN_RATING + " and " + Review.MAX_RATING);
        }
        if (menuItemId == null || !menuItemRepository.existsById(menuItemId)) {
            throw new NotFoundException("Menu item not found");
        }
        if (user.isStaff() || !hasPastConfirmedVisit(user)) {
            throw new ReviewNotAllowedException("Only customers with a past confirmed reservation can leave reviews.");
        }

        try {
            Review saved = transactionRunner.execute("review:" + menuItemId + ":" + user.getId(), () -> {
                if (reviewRepository.existsByMenuItemIdAndUserId(menuItemId, user.getId())) {
                    throw new DuplicateReviewException("You have already reviewed this menu item.");
                }
                Review review = new Review();
                review.setMenuItemId(menuItemId);
                review.setUserId(user.getId());
                review.setRating(rating);
                review.setComment(comment == null ? "" : comment.trim());
                review.setCreatedAt(LocalDateTime.now(clock));
                return reviewRepository.save(review);
            });
            logger.info("[ReviewService] User {} reviewed menu item {} ({} stars)", user.getId(), menuItemId, rating);
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateReviewException("You have already reviewed this menu item.", e);
        }
    }

    public List<Review> listReviews(Long menuItemId) {
        if (menuItemId != null) {
            return reviewRepository.findByMenuItemIdOrderByCreatedAtDescIdDesc(menuItemId);
        }
        return reviewRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    public void deleteReview(Long callerId, Long reviewId) {
        User user = callerResolver.requireUser(callerId);
        transactionRunner.execute("review-delete:" + reviewId, () -> {
            Review review = reviewRepository.findById(reviewId)
                    .orElseThrow(() -> new NotFoundException("Review not found"));
            if (!user.isStaff() && !user.getId().equals(review.getUserId())) {
                throw new ForbiddenRoleException("You can only delete your own reviews");
            }
            reviewRepository.delete(review);
            return null;
        });
        logger.info("[ReviewService] Review {} deleted by user {}", reviewId, user.getId());
    }
}

package com.calmtable.restaurant.service;

import com.calmtable.restaurant.exception.AuthenticationRequiredException;
import com.calmtable.restaurant.exception.ForbiddenRoleException;
import com.calmtable.restaurant.model.User;
import com.calmtable.restaurant.repository.UserRepository;
import org.springframework.stereotype.Component;

/**
 * Maps the authenticated user id to an account and applies the customer/staff role rules
 * shared by reservations, checkout and reviews.
 */
@Component
public class CallerResolver {

    private final UserRepository userRepository;

    public CallerResolver(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public User requireUser(Long callerId) {
        if (callerId == null) {
            throw new AuthenticationRequiredException();
        }
        User user = userRepository.findById(callerId)
                .orElseThrow(AuthenticationRequiredException::new);
        if (!Boolean.TRUE.equals(user.getActive())) {
            throw new AuthenticationRequiredException("Account is disabled");
        }
        return user;
    }

    public User requireCustomer(Long callerId, String action) {
        User user = requireUser(callerId);
        if (user.isStaff()) {
            throw new ForbiddenRoleException("Staff accounts cannot " + action);
        }
        return user;
    }
}

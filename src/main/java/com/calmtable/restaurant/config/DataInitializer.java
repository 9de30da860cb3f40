package com.calmtable.restaurant.config;

import com.calmtable.restaurant.model.MenuCategory;
import com.calmtable.restaurant.model.MenuItem;
import com.calmtable.restaurant.model.User;
import com.calmtable.restaurant.repository.MenuItemRepository;
import com.calmtable.restaurant.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Seeds the sample menu and an optional bootstrap admin account on startup. Both steps are
 * idempotent and skip rows that already exist.
 */
@Component
public class DataInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(DataInitializer.class);

    private final MenuItemRepository menuItemRepository;
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final boolean seedMenu;
    private final String adminEmail;
    private final String adminPassword;

    public DataInitializer(MenuItemRepository menuItemRepository,
                           UserRepository userRepository,
                           PasswordEncoder passwordEncoder,
                           @Value("${calmtable.seed.menu:true}") boolean seedMenu,
                           @Value("${calmtable.bootstrap.admin-email:}") String adminEmail,
                           @Value("${calmtable.bootstrap.admin-password:}") String adminPassword) {
        this.menuItemRepository = menuItemRepository;
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.seedMenu = seedMenu;
        this.adminEmail = adminEmail;
        this.adminPassword = adminPassword;
    }

    @Override
    @Transactional
    public void run(String... args) {
        if (seedMenu) {
            seedMenuItems();
        }
        if (!adminEmail.isBlank() && !adminPassword.isBlank()) {
            ensureAdmin();
        }
    }

    private void seedMenuItems() {
        int created = 0;
        for (MenuItem item : sampleMenu()) {
            if (!menuItemRepository.existsByNameIgnoreCase(item.getName())) {
                menuItemRepository.save(item);
                created++;
            }
        }
        logger.info("[DataInitializer] Seed complete, created {} menu item(s)", created);
    }

    private void ensureAdmin() {
        if (userRepository.existsByEmailIgnoreCase(adminEmail)) {
            return;
        }
        User admin = new User();
        admin.setEmail(adminEmail.trim().toLowerCase());
        admin.setPassword(passwordEncoder.encode(adminPassword));
        admin.setFirstName("Calm Table");
        admin.setLastName("Admin");
        admin.setRole(User.ROLE_ADMIN);
        admin.setActive(true);
        userRepository.save(admin);
        logger.info("[DataInitializer] Created bootstrap admin account {}", admin.getEmail());
    }

    private static List<MenuItem> sampleMenu() {
        return List.of(
                item("Smoked Tomato Bruschetta", "Charred sourdough with tomato confit, basil oil, and sea salt.",
                        "9.50", MenuCategory.STARTERS, true, "vegetarian"),
                item("Herb Butter Ribeye", "Prime ribeye, truffle mash, broccolini, and rosemary jus.",
                        "28.00", MenuCategory.MAINS, true, "gluten-free"),
                item("Citrus Creme Brulee", "Vanilla custard with caramel shell and candied citrus zest.",
                        "8.00", MenuCategory.DESSERTS, false, "vegetarian"),
                item("Garden Sparkler", "House botanical soda with cucumber, lime, and mint.",
                        "5.50", MenuCategory.DRINKS, false, "vegan", "gluten-free"));
    }

    private static MenuItem item(String name, String description, String price, MenuCategory category,
                                 boolean featured, String... tags) {
        MenuItem item = new MenuItem();
        item.setName(name);
        item.setDescription(description);
        item.setPrice(new BigDecimal(price));
        item.setCategory(category);
        item.setAvailable(true);
        item.setFeatured(featured);
        item.setDietaryTags(new LinkedHashSet<>(List.of(tags)));
        return item;
    }
}

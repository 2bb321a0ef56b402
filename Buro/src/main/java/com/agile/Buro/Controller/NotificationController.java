package com.agile.Buro.Controller;

import com.agile.Buro.Models.NotiModel;
import com.agile.Buro.Service.CurrentUserService;
import com.agile.Buro.Service.NotificationService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final NotificationService notificationService;
    private final CurrentUserService currentUser;

    public NotificationController(NotificationService notificationService, CurrentUserService currentUser) {
        this.notificationService = notificationService;
        this.currentUser = currentUser;
    }

    @GetMapping
    public List<NotiModel> list(@RequestParam(defaultValue = "false") boolean unreadOnly,
                                Authentication authentication) {
        return notificationService.listFor(currentUser.require(authentication), unreadOnly);
    }

    @PutMapping("/{id}/read")
    public ResponseEntity<NotiModel> markAsRead(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(notificationService.markAsRead(currentUser.require(authentication), id));
    }

    @PutMapping("/read-all")
    public ResponseEntity<Map<String, Integer>> markAllAsRead(Authentication authentication) {
        int updated = notificationService.markAllAsRead(currentUser.require(authentication));
        return ResponseEntity.ok(Map.of("updated", updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id, Authentication authentication) {
        notificationService.delete(currentUser.require(authentication), id);
        return ResponseEntity.noContent().build();
    }
}

package com.agile.Buro.Controller;

import com.agile.Buro.Models.PageModel;
import com.agile.Buro.Models.UserModel;
import com.agile.Buro.Service.CurrentUserService;
import com.agile.Buro.Service.UserService;
import com.agile.Buro.dto.request.ChangePasswordRequest;
import com.agile.Buro.dto.request.UserUpdateRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService userService;
    private final CurrentUserService currentUser;

    public UserController(UserService userService, CurrentUserService currentUser) {
        this.userService = userService;
        this.currentUser = currentUser;
    }

    @GetMapping
    public ResponseEntity<PageModel<UserModel>> listUsers(@RequestParam(required = false) String search,
                                                          @RequestParam(required = false) Integer skip,
                                                          @RequestParam(required = false) Integer limit,
                                                          Authentication authentication) {
        return ResponseEntity.ok(userService.listUsers(search, skip, limit, currentUser.require(authentication)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<UserModel> getUser(@PathVariable("id") UUID id, Authentication authentication) {
        return ResponseEntity.ok(userService.getUser(id, currentUser.require(authentication)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<UserModel> updateUser(@PathVariable("id") UUID id,
                                                @RequestBody UserUpdateRequest req,
                                                Authentication authentication) {
        return ResponseEntity.ok(userService.updateUser(id, req.toUpdate(), currentUser.require(authentication)));
    }

    @PostMapping("/change-password")
    public ResponseEntity<Map<String, String>> changePassword(@RequestBody @Valid ChangePasswordRequest req,
                                                              Authentication authentication) {
        userService.changePassword(currentUser.require(authentication), req);
        return ResponseEntity.ok(Map.of("message", "Password changed successfully"));
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<UserModel> deactivate(@PathVariable("id") UUID id, Authentication authentication) {
        return ResponseEntity.ok(userService.deactivate(id, currentUser.require(authentication)));
    }

    @PostMapping("/{id}/activate")
    public ResponseEntity<UserModel> activate(@PathVariable("id") UUID id, Authentication authentication) {
        return ResponseEntity.ok(userService.activate(id, currentUser.require(authentication)));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteUser(@PathVariable("id") UUID id, Authentication authentication) {
        userService.deleteUser(id, currentUser.require(authentication));
        return ResponseEntity.noContent().build();
    }
}

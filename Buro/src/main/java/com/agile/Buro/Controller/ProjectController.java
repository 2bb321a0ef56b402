package com.agile.Buro.Controller;

import com.agile.Buro.Models.ProjectMemberModel;
import com.agile.Buro.Models.ProjectModel;
import com.agile.Buro.Models.ProjectStatsModel;
import com.agile.Buro.Service.CurrentUserService;
import com.agile.Buro.Service.ProjectService;
import com.agile.Buro.dto.request.ProjectCreateRequest;
import com.agile.Buro.dto.request.ProjectMemberRequest;
import com.agile.Buro.dto.request.ProjectUpdateRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final ProjectService projectService;
    private final CurrentUserService currentUser;

    public ProjectController(ProjectService projectService, CurrentUserService currentUser) {
        this.projectService = projectService;
        this.currentUser = currentUser;
    }

    @GetMapping
    public ResponseEntity<List<ProjectModel>> listProjects(Authentication authentication) {
        return ResponseEntity.ok(projectService.listUserProjects(currentUser.require(authentication)));
    }

    @PostMapping
    public ResponseEntity<ProjectModel> createProject(@RequestBody @Valid ProjectCreateRequest req,
                                                      Authentication authentication) {
        ProjectModel created = projectService.createProject(req, currentUser.require(authentication));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProjectModel> getProject(@PathVariable("id") UUID id, Authentication authentication) {
        return ResponseEntity.ok(projectService.getProject(id, currentUser.require(authentication)));
    }

    @GetMapping("/key/{key}")
    public ResponseEntity<ProjectModel> getProjectByKey(@PathVariable("key") String key,
                                                        Authentication authentication) {
        return ResponseEntity.ok(projectService.getProjectByKey(key, currentUser.require(authentication)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ProjectModel> updateProject(@PathVariable("id") UUID id,
                                                      @RequestBody ProjectUpdateRequest req,
                                                      Authentication authentication) {
        return ResponseEntity.ok(projectService.updateProject(id, req.toUpdate(), currentUser.require(authentication)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteProject(@PathVariable("id") UUID id, Authentication authentication) {
        projectService.deleteProject(id, currentUser.require(authentication));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/stats")
    public ResponseEntity<ProjectStatsModel> getStats(@PathVariable("id") UUID id, Authentication authentication) {
        return ResponseEntity.ok(projectService.getProjectStats(id, currentUser.require(authentication)));
    }

    /* ===================== MEMBERS ===================== */

    @GetMapping("/{id}/members")
    public ResponseEntity<List<ProjectMemberModel>> listMembers(@PathVariable("id") UUID id,
                                                                Authentication authentication) {
        return ResponseEntity.ok(projectService.listMembers(id, currentUser.require(authentication)));
    }

    @PostMapping("/{id}/members")
    public ResponseEntity<ProjectMemberModel> addMember(@PathVariable("id") UUID id,
                                                        @RequestBody @Valid ProjectMemberRequest req,
                                                        Authentication authentication) {
        ProjectMemberModel member = projectService.addMember(id, req.userId(), currentUser.require(authentication));
        return ResponseEntity.status(HttpStatus.CREATED).body(member);
    }

    @DeleteMapping("/{id}/members/{userId}")
    public ResponseEntity<Void> removeMember(@PathVariable("id") UUID id,
                                             @PathVariable("userId") UUID userId,
                                             Authentication authentication) {
        projectService.removeMember(id, userId, currentUser.require(authentication));
        return ResponseEntity.noContent().build();
    }
}

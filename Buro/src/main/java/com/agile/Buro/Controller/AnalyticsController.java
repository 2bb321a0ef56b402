package com.agile.Buro.Controller;

import com.agile.Buro.Models.AnalyticsModel;
import com.agile.Buro.Service.AnalyticsService;
import com.agile.Buro.Service.CurrentUserService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {

    private final AnalyticsService analyticsService;
    private final CurrentUserService currentUser;

    public AnalyticsController(AnalyticsService analyticsService, CurrentUserService currentUser) {
        this.analyticsService = analyticsService;
        this.currentUser = currentUser;
    }

    @GetMapping("/projects/{projectId}/overview")
    public ResponseEntity<AnalyticsModel.ProjectOverviewDTO> overview(@PathVariable("projectId") UUID projectId,
                                                                      Authentication authentication) {
        return ResponseEntity.ok(analyticsService.projectOverview(projectId, currentUser.require(authentication)));
    }

    @GetMapping("/projects/{projectId}/burndown")
    public ResponseEntity<AnalyticsModel.BurndownDTO> burndown(@PathVariable("projectId") UUID projectId,
                                                               Authentication authentication) {
        return ResponseEntity.ok(analyticsService.burndown(projectId, currentUser.require(authentication)));
    }

    @GetMapping("/velocity/{userId}")
    public ResponseEntity<AnalyticsModel.UserVelocityDTO> userVelocity(@PathVariable("userId") UUID userId,
                                                                       @RequestParam(required = false) Integer weeks,
                                                                       Authentication authentication) {
        return ResponseEntity.ok(analyticsService.userVelocity(userId, weeks, currentUser.require(authentication)));
    }

    @GetMapping("/team/velocity")
    public ResponseEntity<AnalyticsModel.TeamVelocityDTO> teamVelocity(@RequestParam(required = false) Integer weeks,
                                                                       @RequestParam(required = false) UUID projectId,
                                                                       Authentication authentication) {
        return ResponseEntity.ok(analyticsService.teamVelocity(weeks, projectId, currentUser.require(authentication)));
    }

    @GetMapping("/issues/aging")
    public ResponseEntity<AnalyticsModel.AgingReportDTO> aging(@RequestParam(required = false) List<UUID> projectIds,
                                                               Authentication authentication) {
        return ResponseEntity.ok(analyticsService.agingReport(projectIds, currentUser.require(authentication)));
    }

    @GetMapping("/issues/workload")
    public ResponseEntity<AnalyticsModel.WorkloadDTO> workload(@RequestParam(required = false) List<UUID> projectIds,
                                                               Authentication authentication) {
        return ResponseEntity.ok(analyticsService.workload(projectIds, currentUser.require(authentication)));
    }

    @GetMapping("/dashboard")
    public ResponseEntity<List<AnalyticsModel.DashboardDTO>> dashboard(Authentication authentication) {
        return ResponseEntity.ok(analyticsService.dashboard(currentUser.require(authentication)));
    }
}

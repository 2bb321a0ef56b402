package com.agile.Buro.Controller;

import com.agile.Buro.Models.IssueModel;
import com.agile.Buro.Models.KanbanBoardModel;
import com.agile.Buro.Models.PageModel;
import com.agile.Buro.Service.CurrentUserService;
import com.agile.Buro.Service.IssueService;
import com.agile.Buro.dto.IssueFilter;
import com.agile.Buro.dto.request.IssueCreateRequest;
import com.agile.Buro.dto.request.IssueStatusRequest;
import com.agile.Buro.dto.request.IssueUpdateRequest;
import com.agile.Buro.entity.IssuePriority;
import com.agile.Buro.entity.IssueStatus;
import com.agile.Buro.entity.IssueType;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/issues")
public class IssueController {

    private final IssueService issueService;
    private final CurrentUserService currentUser;

    public IssueController(IssueService issueService, CurrentUserService currentUser) {
        this.issueService = issueService;
        this.currentUser = currentUser;
    }

    @GetMapping
    public ResponseEntity<PageModel<IssueModel>> listIssues(
            @RequestParam(required = false) UUID projectId,
            @RequestParam(required = false) UUID assigneeId,
            @RequestParam(required = false) UUID reporterId,
            @RequestParam(required = false) IssueStatus status,
            @RequestParam(required = false) IssueType type,
            @RequestParam(required = false) IssuePriority priority,
            @RequestParam(required = false) Integer skip,
            @RequestParam(required = false) Integer limit,
            Authentication authentication) {
        IssueFilter filter = new IssueFilter(projectId, assigneeId, reporterId, status, type, priority);
        return ResponseEntity.ok(issueService.listIssues(filter, currentUser.require(authentication), skip, limit));
    }

    @PostMapping
    public ResponseEntity<IssueModel> createIssue(@RequestBody @Valid IssueCreateRequest req,
                                                  Authentication authentication) {
        IssueModel created = issueService.createIssue(req, currentUser.require(authentication));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    public ResponseEntity<IssueModel> getIssue(@PathVariable("id") UUID id, Authentication authentication) {
        return ResponseEntity.ok(issueService.getIssue(id, currentUser.require(authentication)));
    }

    @GetMapping("/{projectKey}/{number}")
    public ResponseEntity<IssueModel> getIssueByKey(@PathVariable("projectKey") String projectKey,
                                                    @PathVariable("number") int number,
                                                    Authentication authentication) {
        return ResponseEntity.ok(issueService.getIssueByKey(projectKey, number, currentUser.require(authentication)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<IssueModel> updateIssue(@PathVariable("id") UUID id,
                                                  @RequestBody IssueUpdateRequest req,
                                                  Authentication authentication) {
        return ResponseEntity.ok(issueService.updateIssue(id, req.toUpdate(), currentUser.require(authentication)));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<IssueModel> transitionStatus(@PathVariable("id") UUID id,
                                                       @RequestBody @Valid IssueStatusRequest req,
                                                       Authentication authentication) {
        return ResponseEntity.ok(issueService.transitionStatus(id, req.status(), currentUser.require(authentication)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteIssue(@PathVariable("id") UUID id, Authentication authentication) {
        issueService.deleteIssue(id, currentUser.require(authentication));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/projects/{projectId}/kanban")
    public ResponseEntity<KanbanBoardModel> kanban(@PathVariable("projectId") UUID projectId,
                                                   Authentication authentication) {
        return ResponseEntity.ok(issueService.kanbanBoard(projectId, currentUser.require(authentication)));
    }
}

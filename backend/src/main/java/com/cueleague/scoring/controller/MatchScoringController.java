package com.cueleague.scoring.controller;

import com.cueleague.scoring.dto.MatchScoringResponses;
import com.cueleague.scoring.dto.ScoringRequests;
import com.cueleague.scoring.model.ScoringSession;
import com.cueleague.scoring.model.TeamSide;
import com.cueleague.scoring.service.GameConfirmationService;
import com.cueleague.scoring.service.MatchEndVerifier;
import com.cueleague.scoring.service.MatchGameProvisioningService;
import com.cueleague.scoring.service.MatchScoreboardService;
import com.cueleague.scoring.service.PlayerReassignmentService;
import com.cueleague.scoring.service.ScoringSessionResolver;
import com.cueleague.scoring.web.ScoringException;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/api/matches/{matchId}")
public class MatchScoringController {

    static final String MEMBER_HEADER = "X-Member-Id";
    static final String TEAM_HEADER = "X-Team-Id";

    private final ScoringSessionResolver scoringSessionResolver;
    private final GameConfirmationService gameConfirmationService;
    private final MatchEndVerifier matchEndVerifier;
    private final MatchGameProvisioningService matchGameProvisioningService;
    private final PlayerReassignmentService playerReassignmentService;
    private final MatchScoreboardService matchScoreboardService;

    public MatchScoringController(
            ScoringSessionResolver scoringSessionResolver,
            GameConfirmationService gameConfirmationService,
            MatchEndVerifier matchEndVerifier,
            MatchGameProvisioningService matchGameProvisioningService,
            PlayerReassignmentService playerReassignmentService,
            MatchScoreboardService matchScoreboardService
    ) {
        this.scoringSessionResolver = scoringSessionResolver;
        this.gameConfirmationService = gameConfirmationService;
        this.matchEndVerifier = matchEndVerifier;
        this.matchGameProvisioningService = matchGameProvisioningService;
        this.playerReassignmentService = playerReassignmentService;
        this.matchScoreboardService = matchScoreboardService;
    }

    @GetMapping
    public ResponseEntity<MatchScoringResponses.MatchView> getMatch(@PathVariable UUID matchId) {
        return ResponseEntity.ok(matchScoreboardService.getMatch(matchId));
    }

    @GetMapping("/games")
    public ResponseEntity<List<MatchScoringResponses.GameView>> listGames(@PathVariable UUID matchId) {
        return ResponseEntity.ok(matchScoreboardService.listGames(matchId));
    }

    @GetMapping("/scoreboard")
    public ResponseEntity<MatchScoringResponses.Scoreboard> getScoreboard(@PathVariable UUID matchId) {
        return ResponseEntity.ok(matchScoreboardService.getScoreboard(matchId));
    }

    @PostMapping("/games/provision")
    public ResponseEntity<MatchScoringResponses.GameBatchResult> provisionGames(
            @PathVariable UUID matchId,
            @RequestHeader(MEMBER_HEADER) UUID memberId,
            @RequestHeader(TEAM_HEADER) UUID teamId
    ) {
        ScoringSession session = scoringSessionResolver.resolve(matchId, memberId, teamId);
        MatchScoringResponses.GameBatchResult result =
                matchGameProvisioningService.provisionRegulationGames(matchId, session);
        return ResponseEntity.status(result.changed() ? HttpStatus.CREATED : HttpStatus.OK).body(result);
    }

    @PostMapping("/games/{gameId}/propose")
    public ResponseEntity<MatchScoringResponses.GameTransitionResult> propose(
            @PathVariable UUID matchId,
            @PathVariable UUID gameId,
            @RequestHeader(MEMBER_HEADER) UUID memberId,
            @RequestHeader(TEAM_HEADER) UUID teamId,
            @Valid @RequestBody ScoringRequests.ProposeResultRequest request
    ) {
        ScoringSession session = scoringSessionResolver.resolve(matchId, memberId, teamId);
        return ResponseEntity.ok(gameConfirmationService.propose(matchId, gameId, session, request));
    }

    @PostMapping("/games/{gameId}/confirm")
    public ResponseEntity<MatchScoringResponses.GameTransitionResult> confirm(
            @PathVariable UUID matchId,
            @PathVariable UUID gameId,
            @RequestHeader(MEMBER_HEADER) UUID memberId,
            @RequestHeader(TEAM_HEADER) UUID teamId,
            @Valid @RequestBody(required = false) ScoringRequests.GameActionRequest request
    ) {
        ScoringSession session = scoringSessionResolver.resolve(matchId, memberId, teamId);
        return ResponseEntity.ok(gameConfirmationService.confirm(matchId, gameId, session, request));
    }

    @PostMapping("/games/{gameId}/deny")
    public ResponseEntity<MatchScoringResponses.GameTransitionResult> deny(
            @PathVariable UUID matchId,
            @PathVariable UUID gameId,
            @RequestHeader(MEMBER_HEADER) UUID memberId,
            @RequestHeader(TEAM_HEADER) UUID teamId,
            @Valid @RequestBody(required = false) ScoringRequests.GameActionRequest request
    ) {
        ScoringSession session = scoringSessionResolver.resolve(matchId, memberId, teamId);
        return ResponseEntity.ok(gameConfirmationService.deny(matchId, gameId, session, request));
    }

    @PostMapping("/games/{gameId}/vacate")
    public ResponseEntity<MatchScoringResponses.GameTransitionResult> requestVacate(
            @PathVariable UUID matchId,
            @PathVariable UUID gameId,
            @RequestHeader(MEMBER_HEADER) UUID memberId,
            @RequestHeader(TEAM_HEADER) UUID teamId,
            @Valid @RequestBody(required = false) ScoringRequests.GameActionRequest request
    ) {
        ScoringSession session = scoringSessionResolver.resolve(matchId, memberId, teamId);
        return ResponseEntity.ok(gameConfirmationService.requestVacate(matchId, gameId, session, request));
    }

    @PostMapping("/games/{gameId}/vacate/accept")
    public ResponseEntity<MatchScoringResponses.GameTransitionResult> acceptVacate(
            @PathVariable UUID matchId,
            @PathVariable UUID gameId,
            @RequestHeader(MEMBER_HEADER) UUID memberId,
            @RequestHeader(TEAM_HEADER) UUID teamId,
            @Valid @RequestBody(required = false) ScoringRequests.GameActionRequest request
    ) {
        ScoringSession session = scoringSessionResolver.resolve(matchId, memberId, teamId);
        return ResponseEntity.ok(gameConfirmationService.acceptVacate(matchId, gameId, session, request));
    }

    @PostMapping("/games/{gameId}/vacate/deny")
    public ResponseEntity<MatchScoringResponses.GameTransitionResult> denyVacate(
            @PathVariable UUID matchId,
            @PathVariable UUID gameId,
            @RequestHeader(MEMBER_HEADER) UUID memberId,
            @RequestHeader(TEAM_HEADER) UUID teamId,
            @Valid @RequestBody(required = false) ScoringRequests.GameActionRequest request
    ) {
        ScoringSession session = scoringSessionResolver.resolve(matchId, memberId, teamId);
        return ResponseEntity.ok(gameConfirmationService.denyVacate(matchId, gameId, session, request));
    }

    @PostMapping("/verify")
    public ResponseEntity<MatchScoringResponses.MatchTransitionResult> verify(
            @PathVariable UUID matchId,
            @RequestHeader(MEMBER_HEADER) UUID memberId,
            @RequestHeader(TEAM_HEADER) UUID teamId
    ) {
        ScoringSession session = scoringSessionResolver.resolve(matchId, memberId, teamId);
        return ResponseEntity.ok(matchEndVerifier.verify(matchId, session));
    }

    @PostMapping("/lineups/{side}/positions/{position}/substitute")
    public ResponseEntity<MatchScoringResponses.ReassignmentResult> substitute(
            @PathVariable UUID matchId,
            @PathVariable String side,
            @PathVariable int position,
            @RequestHeader(MEMBER_HEADER) UUID memberId,
            @RequestHeader(TEAM_HEADER) UUID teamId,
            @Valid @RequestBody ScoringRequests.SubstitutePlayerRequest request
    ) {
        ScoringSession session = scoringSessionResolver.resolve(matchId, memberId, teamId);
        return ResponseEntity.ok(playerReassignmentService.substitute(
                matchId,
                parseSide(side),
                position,
                session,
                request
        ));
    }

    private static TeamSide parseSide(String raw) {
        try {
            return TeamSide.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw ScoringException.constraintViolation("Unknown team side: " + raw);
        }
    }
}

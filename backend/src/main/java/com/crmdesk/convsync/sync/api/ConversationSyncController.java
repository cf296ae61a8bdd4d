package com.crmdesk.convsync.sync.api;

import com.crmdesk.convsync.common.api.ApiResponse;
import com.crmdesk.convsync.sync.send.OutboundMessageService;
import com.crmdesk.convsync.sync.service.SyncSession;
import com.crmdesk.convsync.sync.service.SyncSessionRegistry;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/sync/conversations/{conversationId}")
public class ConversationSyncController {

    private final SyncSessionRegistry registry;
    private final OutboundMessageService outboundMessageService;

    public ConversationSyncController(SyncSessionRegistry registry, OutboundMessageService outboundMessageService) {
        this.registry = registry;
        this.outboundMessageService = outboundMessageService;
    }

    @PostMapping("/session")
    public ApiResponse<SessionStatus> open(@PathVariable String conversationId) {
        return ApiResponse.ok(SessionStatus.of(registry.open(conversationId)));
    }

    @GetMapping("/session")
    public ApiResponse<SessionStatus> status(@PathVariable String conversationId) {
        return ApiResponse.ok(SessionStatus.of(requireSession(conversationId)));
    }

    @PostMapping("/session/resubscribe")
    public ApiResponse<SessionStatus> resubscribe(@PathVariable String conversationId) {
        var session = requireSession(conversationId);
        session.restartChangeStream();
        return ApiResponse.ok(SessionStatus.of(session));
    }

    @DeleteMapping("/session")
    public ApiResponse<Void> close(@PathVariable String conversationId) {
        if (!registry.close(conversationId)) {
            throw new IllegalArgumentException("session_not_found");
        }
        return ApiResponse.ok(null);
    }

    @GetMapping("/messages")
    public ApiResponse<List<MessageView>> messages(@PathVariable String conversationId) {
        var items = requireSession(conversationId).messages().stream().map(MessageView::of).toList();
        return ApiResponse.ok(items);
    }

    @PostMapping("/messages")
    public ApiResponse<SendMessageResponse> send(
            @PathVariable String conversationId,
            @Valid @RequestBody SendMessageRequest req
    ) {
        var messageId = outboundMessageService.send(conversationId, req.text(), req.reply_to(), req.sender(), req.metadata());
        return ApiResponse.ok(new SendMessageResponse(messageId));
    }

    private SyncSession requireSession(String conversationId) {
        return registry.find(conversationId)
                .orElseThrow(() -> new IllegalArgumentException("session_not_found"));
    }
}

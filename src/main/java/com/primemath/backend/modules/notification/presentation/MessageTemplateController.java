package com.primemath.backend.modules.notification.presentation;

import java.util.List;
import java.util.UUID;

import com.primemath.backend.modules.notification.application.MessageTemplateService;
import com.primemath.backend.modules.notification.presentation.dto.CreateMessageTemplateRequest;
import com.primemath.backend.modules.notification.presentation.dto.MessageTemplateResponse;
import com.primemath.backend.modules.notification.presentation.dto.UpdateMessageTemplateRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/message-templates")
public class MessageTemplateController {

    private final MessageTemplateService messageTemplateService;

    public MessageTemplateController(MessageTemplateService messageTemplateService) {
        this.messageTemplateService = messageTemplateService;
    }

    @GetMapping
    public ResponseEntity<List<MessageTemplateResponse>> listTemplates(@RequestParam("centerId") UUID centerId) {
        return ResponseEntity.ok(messageTemplateService.listTemplates(centerId));
    }

    @PostMapping
    public ResponseEntity<MessageTemplateResponse> createTemplate(@Valid @RequestBody CreateMessageTemplateRequest request) {
        return ResponseEntity.status(201).body(messageTemplateService.createTemplate(request));
    }

    @PatchMapping("/{templateId}")
    public ResponseEntity<MessageTemplateResponse> updateTemplate(
            @PathVariable("templateId") UUID templateId,
            @Valid @RequestBody UpdateMessageTemplateRequest request
    ) {
        return ResponseEntity.ok(messageTemplateService.updateTemplate(templateId, request));
    }

    @DeleteMapping("/{templateId}")
    public ResponseEntity<Void> deleteTemplate(@PathVariable("templateId") UUID templateId) {
        messageTemplateService.deleteTemplate(templateId);
        return ResponseEntity.noContent().build();
    }
}

package com.primemath.backend.modules.notification.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.primemath.backend.global.error.ProblemException;
import com.primemath.backend.modules.attendance.domain.event.AttendanceNotificationType;
import com.primemath.backend.modules.notification.domain.MessageTemplate;
import com.primemath.backend.modules.notification.infrastructure.persistence.MessageTemplateRepository;
import com.primemath.backend.modules.notification.presentation.dto.CreateMessageTemplateRequest;
import com.primemath.backend.modules.notification.presentation.dto.MessageTemplateResponse;
import com.primemath.backend.modules.notification.presentation.dto.UpdateMessageTemplateRequest;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MessageTemplateService {

    private final MessageTemplateRepository messageTemplateRepository;

    public MessageTemplateService(MessageTemplateRepository messageTemplateRepository) {
        this.messageTemplateRepository = messageTemplateRepository;
    }

    @Transactional(readOnly = true)
    public List<MessageTemplateResponse> listTemplates(UUID centerId) {
        return messageTemplateRepository.findByCenterIdOrderByCreatedAtAsc(centerId).stream()
                .map(MessageTemplateResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<MessageTemplate> findActiveTemplate(UUID centerId, AttendanceNotificationType type) {
        return messageTemplateRepository.findFirstByCenterIdAndTypeAndActiveTrueOrderByUpdatedAtDesc(centerId, type);
    }

    public MessageTemplateResponse createTemplate(CreateMessageTemplateRequest request) {
        MessageTemplate template = new MessageTemplate(
                request.centerId(),
                parseType(request.type()),
                request.title().trim(),
                request.body()
        );
        if (request.active() != null) {
            template.setActive(request.active());
        }
        return MessageTemplateResponse.from(messageTemplateRepository.save(template));
    }

    public MessageTemplateResponse updateTemplate(UUID templateId, UpdateMessageTemplateRequest request) {
        MessageTemplate template = loadTemplate(templateId);
        if (request.type() != null) {
            template.setType(parseType(request.type()));
        }
        if (request.title() != null && !request.title().isBlank()) {
            template.setTitle(request.title().trim());
        }
        if (request.body() != null && !request.body().isBlank()) {
            template.setBody(request.body());
        }
        if (request.active() != null) {
            template.setActive(request.active());
        }
        return MessageTemplateResponse.from(template);
    }

    public void deleteTemplate(UUID templateId) {
        messageTemplateRepository.delete(loadTemplate(templateId));
    }

    private MessageTemplate loadTemplate(UUID templateId) {
        return messageTemplateRepository.findById(templateId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "message_template.not_found",
                        "메시지 템플릿을 찾을 수 없습니다"));
    }

    private static AttendanceNotificationType parseType(String raw) {
        return AttendanceNotificationType.fromTemplateKey(raw)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "message_template.invalid_type",
                        "템플릿 유형은 check_in, late, check_out 중 하나입니다"));
    }
}

package com.radar.lendservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.radar.lendcommon.event.LoanEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 借贷事件发布
 * 使用Redis Pub/Sub，按账户所有者分频道，在事务提交后调用；发布失败只记录日志，不影响已提交的结果
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventPublisher {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    /** 借贷事件频道 */
    static final String LOAN_EVENT_CHANNEL = "event:loan:";

    public void publish(LoanEvent event) {
        if (event == null || event.getOwnerId() == null) {
            log.warn("无效的LoanEvent");
            return;
        }

        try {
            String channel = LOAN_EVENT_CHANNEL + event.getOwnerId();
            String message = objectMapper.writeValueAsString(event);
            stringRedisTemplate.convertAndSend(channel, message);

            log.info("发布借贷事件: ownerId={}, type={}, loanId={}, amount={}",
                    event.getOwnerId(), event.getType(), event.getLoanId(), event.getAmount());
        } catch (JsonProcessingException e) {
            log.error("序列化LoanEvent失败", e);
        } catch (DataAccessException e) {
            log.warn("发布借贷事件失败 ownerId={} type={}: {}", event.getOwnerId(), event.getType(), e.getMessage());
        }
    }

    public void publishAll(List<LoanEvent> events) {
        if (events == null) {
            return;
        }
        events.forEach(this::publish);
    }
}

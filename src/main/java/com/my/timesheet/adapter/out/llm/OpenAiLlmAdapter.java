package com.my.timesheet.adapter.out.llm;

import com.my.timesheet.config.AppConfig;
import com.my.timesheet.domain.exception.IntentParseException;
import com.my.timesheet.domain.model.LlmResponse;
import com.my.timesheet.domain.port.out.ClockPort;
import com.my.timesheet.domain.port.out.LlmPort;
import com.my.timesheet.domain.service.daterange.WorkCalendar;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.service.AiServices;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Fallback;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.time.LocalDate;

/**
 * 왜: LLM 호출을 도메인 포트 계약에 맞게 감싸 타임시트 의도를 JSON 원문으로 안정적으로 제공하기 위함.
 *
 * <p>재시도 후에도 실패하면 success=false 응답으로 바꿔 도메인이 대체 경로를 타게 한다.
 */
@ApplicationScoped
public class OpenAiLlmAdapter implements LlmPort {

    private static final Logger log = Logger.getLogger(OpenAiLlmAdapter.class);

    private final IntentAssistant assistant;
    private final ClockPort clockPort;

    @Inject
    public OpenAiLlmAdapter(AppConfig appConfig, ClockPort clockPort) {
        String apiKey = appConfig.openai().apiKey().orElse("");
        OpenAiChatModel model = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(appConfig.openai().model())
                .temperature(appConfig.openai().temperature())
                .build();
        this.assistant = AiServices.builder(IntentAssistant.class)
                .chatLanguageModel(model)
                .build();
        this.clockPort = clockPort;
    }

    OpenAiLlmAdapter(IntentAssistant assistant, ClockPort clockPort) {
        this.assistant = assistant;
        this.clockPort = clockPort;
    }

    @Override
    @Retry(maxRetries = 2, delay = 1000, abortOn = IntentParseException.class)
    @Fallback(fallbackMethod = "unavailable")
    public LlmResponse parseTimesheetIntent(String prompt, String timezone, String weekStart) {
        String zone = timezone == null || timezone.isBlank() ? "UTC" : timezone;
        LocalDate today = clockPort.now().atZoneSameInstant(WorkCalendar.zoneOrUtc(zone)).toLocalDate();
        String body = assistant.parse(prompt, today.toString(), zone, weekStart == null ? "monday" : weekStart);
        if (body == null || body.isBlank()) {
            throw new IntentParseException("LLM 의도 응답이 비어 있습니다.");
        }
        return LlmResponse.success(body);
    }

    LlmResponse unavailable(String prompt, String timezone, String weekStart) {
        log.warn("LLM 의도 파싱 실패, 사용할 수 없음으로 응답");
        return LlmResponse.failure("AI intent parsing is unavailable.");
    }

    interface IntentAssistant {
        @SystemMessage("""
                Today is {{today}} in timezone {{timezone}}; weeks start on {{weekStart}}.
                Read the user's request to log work hours and answer with ONE JSON object only, no prose:
                {"intent": "create_timesheets" or another short verb if the request is not about logging hours,
                 "date_range": {"type": "absolute", "from": "YYYY-MM-DD", "to": "YYYY-MM-DD"}
                            or {"type": "relative", "value": "this_week|last_week|next_week|last_n_workdays", "count": N},
                 "schedule": [{"from": "HH:mm", "to": "HH:mm"}],
                 "breaks": [{"from": "HH:mm", "to": "HH:mm"}],
                 "project": string or null, "task": string or null, "description": string or null,
                 "location": string or null, "notes": string or null,
                 "missing_fields": [names of required fields you could not determine]}
                Required fields are intent, date_range, schedule and project. Never invent a project name.
                The request may be written in English or Portuguese.
                """)
        String parse(@UserMessage String prompt,
                     @V("today") String today,
                     @V("timezone") String timezone,
                     @V("weekStart") String weekStart);
    }
}

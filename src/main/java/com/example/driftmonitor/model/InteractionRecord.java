package com.example.driftmonitor.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("interaction_log")
public class InteractionRecord implements LogRecord {

    public static final String CATEGORY_REFUSAL = "refusal";
    public static final String CATEGORY_TOXICITY = "toxicity";
    public static final String CATEGORY_ERROR = "error";

    @Id
    private String id;
    private Instant timestamp;
    @Field("user_query")
    private String userQuery;
    @Field("model_response")
    private String modelResponse;
    @Field("refusal_flag")
    private boolean refusalFlag;
    @Field("toxicity_flag")
    private boolean toxicityFlag;
    @Field("error_flag")
    private boolean errorFlag;
    // 0-5 or 0-1 depending on the feedback widget
    @Field("user_feedback_score")
    private Double userFeedbackScore;

    @Override
    public boolean inCategory(String category) {
        switch (category) {
            case CATEGORY_REFUSAL:
                return refusalFlag;
            case CATEGORY_TOXICITY:
                return toxicityFlag;
            case CATEGORY_ERROR:
                return errorFlag;
            default:
                return false;
        }
    }
}

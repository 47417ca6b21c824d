package com.market.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI marketAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Market Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Supervised anomaly scoring for daily price/volume feature series of a single instrument.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Train on a labelled feature CSV via `POST /models/train` (column `anomaly` = 0/1)\n" +
                                "2. Persist or restore the model via `POST /models/save` and `POST /models/load`\n" +
                                "3. Score an unlabelled CSV via `POST /scoring/predict`\n" +
                                "4. Summarize detections via `POST /analytics/report`\n\n" +
                                "**Recognized features:** `return`, `volatility`, `rsi`, `macd`, `macd_diff`, " +
                                "`relative_volume`, `bollinger_band_width`, `log_return`. Any subset may be present.\n\n" +
                                "**Scored columns:** `anomaly_probability`, `anomaly_prediction`, " +
                                "`anomaly_severity` = probability x |return| / 5.\n\n" +
                                "**Scoring outcome** (`X-Scoring-Outcome` header): `SCORED`, " +
                                "`NOTHING_SCORABLE` (columns empty), `DEGRADED` (inference failed, columns 0).")
                        .contact(new Contact().name("Market Surveillance Team")));
    }
}

package personal.labs.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Lab Session Application
 * 실습 세션(Slot) 카탈로그와 예약 원장(Booking)을 담당하는 서비스
 */
@SpringBootApplication(
    scanBasePackages = {
        "personal.labs.core",
        "personal.labs.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class LabSessionApplication {
    public static void main(String[] args) {
        SpringApplication.run(LabSessionApplication.class, args);
    }
}

package arith.todo.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * To-do 저장소 설정. 데이터베이스와 접속 정보는 {@code spring.data.mongodb.*}를 따릅니다.
 *
 * @param collection to-do 문서 컬렉션
 */
@Validated
@ConfigurationProperties(prefix = "todo.store.mongodb")
public record StoreProperties(@DefaultValue("todolist") @NotBlank String collection) {}

package personal.reserve.core.tenant.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import personal.reserve.common.exception.BusinessException;
import personal.reserve.common.exception.ErrorCode;
import personal.reserve.core.tenant.domain.model.TenantSettings;

/**
 * TenantSettings <-> JSON 컬럼 변환기
 * 알 수 없는 키는 무시 (운영자가 다른 용도의 설정을 함께 저장할 수 있음)
 */
@Converter
public class TenantSettingsConverter implements AttributeConverter<TenantSettings, String> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public String convertToDatabaseColumn(TenantSettings settings) {
        if (settings == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to serialize tenant settings");
        }
    }

    @Override
    public TenantSettings convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return TenantSettings.empty();
        }
        try {
            return OBJECT_MAPPER.readValue(json, TenantSettings.class);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to read tenant settings");
        }
    }
}

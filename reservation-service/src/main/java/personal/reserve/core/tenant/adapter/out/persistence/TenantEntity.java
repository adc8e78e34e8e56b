package personal.reserve.core.tenant.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.reserve.core.tenant.domain.model.Tenant;
import personal.reserve.core.tenant.domain.model.TenantSettings;

import java.time.LocalDateTime;

/**
 * Tenant JPA Entity
 * 테넌트 테이블 매핑 (settings는 JSON 문자열로 저장)
 */
@Entity
@Table(name = "tenants",
        indexes = @Index(name = "idx_tenant_slug_active", columnList = "slug, is_active"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TenantEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String slug;

    @Column(nullable = false)
    private String name;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Convert(converter = TenantSettingsConverter.class)
    @Column(length = 2000)
    private TenantSettings settings;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 정적 팩토리 메서드 (운영자 프로비저닝 / 테스트용)
     */
    public static TenantEntity of(String slug, String name, TenantSettings settings) {
        TenantEntity entity = new TenantEntity();
        entity.slug = slug;
        entity.name = name;
        entity.active = true;
        entity.settings = settings;
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public Tenant toDomain() {
        return new Tenant(id, slug, name, active, settings);
    }
}

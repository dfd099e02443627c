package org.sjsu.botworker.model.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.List;
import java.util.Map;

@Entity
@Table(name = "participant")
@Data
@NoArgsConstructor
public class Participant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String code; // Also decides the botworker shard (first character)

    @Column(nullable = false)
    private String sessionCode;

    // Scripted submissions the browser bot plays back, in order
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private List<Map<String, Object>> botSubmits;

    public Participant(String code, String sessionCode) {
        this.code = code;
        this.sessionCode = sessionCode;
    }
}

package fr.imt.stackpilot.stackpilot.infrastructure.persistence;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@Document(collection = "counters")
public class DatabaseSequence {

    @Id
    private String id;

    private long seq;

}

package app.kartoteka.exchange.service.mapping;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class MappingResolver {

    public ResolvedMapping resolve(ColumnMapping mapping) {
        if (mapping == null || mapping.isEmpty()) {
            throw new MappingException("Column mapping is empty");
        }
        Set<TargetField> seen = new HashSet<>();
        List<ResolvedMapping.Column> columns = new ArrayList<>();
        for (FieldMapping field : mapping.fields()) {
            if (field.sourceColumn() == null || field.sourceColumn().isBlank()) {
                throw new MappingException("Source column is required for target " + field.targetField());
            }
            TargetField target = TargetField.parse(field.targetField());
            if (!seen.add(target)) {
                throw new MappingException("Target field '" + target.name() + "' is mapped more than once");
            }
            columns.add(new ResolvedMapping.Column(field, target));
        }
        return new ResolvedMapping(List.copyOf(columns));
    }
}

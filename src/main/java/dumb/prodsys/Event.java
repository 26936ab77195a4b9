package dumb.prodsys;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.prodsys.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

public interface Event {

    default JsonNode toJson() {
        return Json.node(this);
    }

    String getEventType();

    /** One instantiation was selected and executed; {@code derived} is null when its consequent was already known. */
    record FiredEvent(int cycle, String ruleId, Bindings bindings, @Nullable Fact derived,
                      int conflictSetSize) implements Event {
        public FiredEvent {
            requireNonNull(ruleId);
            requireNonNull(bindings);
        }

        @Override
        public String getEventType() {
            return "FiredEvent";
        }
    }

    record DerivedEvent(Fact fact, Provenance why) implements Event {
        public DerivedEvent {
            requireNonNull(fact);
            requireNonNull(why);
        }

        @Override
        public String getEventType() {
            return "DerivedEvent";
        }
    }

    record SaturatedEvent(int cycles, int factCount, List<Fact> derived) implements Event {
        public SaturatedEvent {
            derived = List.copyOf(requireNonNull(derived));
        }

        @Override
        public String getEventType() {
            return "SaturatedEvent";
        }
    }
}

package net.terminus;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public class TestOrder {

    private String id;

    // ok, poison, flaky or recover; see TerminusIntegrationTest.OrderListener
    private String behaviour;

    // Default constructor for Jackson
    public TestOrder() {
    }

    @JsonCreator
    public TestOrder(@JsonProperty("id") String id, @JsonProperty("behaviour") String behaviour) {
        this.id = id;
        this.behaviour = behaviour;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getBehaviour() {
        return behaviour;
    }

    public void setBehaviour(String behaviour) {
        this.behaviour = behaviour;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TestOrder testOrder = (TestOrder) o;
        return Objects.equals(id, testOrder.id) && Objects.equals(behaviour, testOrder.behaviour);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, behaviour);
    }

    @Override
    public String toString() {
        return "TestOrder{" +
                "id='" + id + '\'' +
                ", behaviour='" + behaviour + '\'' +
                '}';
    }
}

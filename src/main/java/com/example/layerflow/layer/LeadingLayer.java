package com.example.layerflow.layer;

import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.model.LayerRole;
import java.util.EnumMap;
import java.util.Map;

/**
 * First stage. Turns the raw external request into directives for the rest of the pipeline
 * and may declare requirements the downstream layers are checked against before a run.
 */
public abstract class LeadingLayer extends AbstractLayer {

  private final Map<LayerRole, Map<String, Object>> downstreamRequirements = new EnumMap<>(LayerRole.class);

  protected LeadingLayer(String name, LayerExpectation expectation) {
    super(name, requireRole(expectation, LayerRole.LEADING));
  }

  @Override
  protected final boolean requiresBoundInput() {
    return false;
  }

  /** The raw request is held to this layer's own input contract. */
  @Override
  protected Map<String, Object> beforeProcess(Map<String, Object> input) {
    return checkRequest(input);
  }

  protected void setDownstreamRequirements(LayerRole role, Map<String, Object> requirements) {
    if (role == LayerRole.LEADING) {
      throw new IllegalArgumentException("downstream requirements apply to later layers only");
    }
    downstreamRequirements.put(role, Map.copyOf(requirements));
  }

  /** Requirements this layer imposes on the given downstream role, empty when none. */
  public Map<String, Object> downstreamRequirements(LayerRole role) {
    return downstreamRequirements.getOrDefault(role, Map.of());
  }

  static LayerExpectation requireRole(LayerExpectation expectation, LayerRole role) {
    if (expectation == null || expectation.getLayerRole() != role) {
      throw new IllegalArgumentException("expectation must be declared for the " + role + " role");
    }
    return expectation;
  }
}

package com.mk.fx.qa.load.engine.resource;

import com.mk.fx.qa.load.engine.dto.controllerresponse.LoadTestRequest;
import com.mk.fx.qa.load.engine.model.SimulationOverrides;
import com.mk.fx.qa.load.engine.model.WorkloadProfile;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface ProfileMapper {

  @Mapping(target = "rampUpSeconds", source = "rampUpSeconds", defaultValue = "0")
  WorkloadProfile toProfile(LoadTestRequest request);

  SimulationOverrides toOverrides(LoadTestRequest.Overrides overrides);
}

package com.ymcmp.arkade.converter;

import com.ymcmp.arkade.abi.ContractArtifact;

public interface Converter {

    public void convert(ContractArtifact artifact);

    public String getResult();

    public void reset();
}

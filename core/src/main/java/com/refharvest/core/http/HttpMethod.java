package com.refharvest.core.http;

public enum HttpMethod { GET, POST }

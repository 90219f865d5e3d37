package io.clubone.donation.baseobject;

import lombok.Data;

@Data
public class Docs {
	private String status;
	private String url;
}

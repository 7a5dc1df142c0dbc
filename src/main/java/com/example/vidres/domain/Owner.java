package com.example.vidres.domain;

/**
 * Who a video job belongs to.
 * <p>
 * A {@link User} submitted the video directly and receives the processed variants back.
 * A {@link ChannelPost} is a video posted in a channel; the processed file replaces the
 * original post in place.
 */
public sealed interface Owner permits Owner.User, Owner.ChannelPost {

    OwnerKey key();

    record User(long userId) implements Owner {
        @Override
        public OwnerKey key() {
            return OwnerKey.user(userId);
        }
    }

    record ChannelPost(long channelId, long messageId) implements Owner {
        @Override
        public OwnerKey key() {
            return OwnerKey.channel(channelId);
        }
    }
}
